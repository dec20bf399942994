package com.identity.matching.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An entry of the external people directory.
 * Immutable snapshot fetched once per matching run; never mutated by the engine.
 */
public final class CandidateRecord {
    private final String externalId;
    private final String name;
    private final Set<String> emails;
    private final Set<String> phones;
    private final String status;

    private CandidateRecord(Builder builder) {
        this.externalId = builder.externalId;
        this.name = builder.name != null ? builder.name : "";
        this.emails = Collections.unmodifiableSet(new LinkedHashSet<>(builder.emails));
        this.phones = Collections.unmodifiableSet(new LinkedHashSet<>(builder.phones));
        this.status = builder.status;
    }

    public String getExternalId() {
        return externalId;
    }

    public String getName() {
        return name;
    }

    public Set<String> getEmails() {
        return emails;
    }

    public Set<String> getPhones() {
        return phones;
    }

    /**
     * Directory status flag such as "active" or "inactive". Informational only.
     */
    public String getStatus() {
        return status;
    }

    /**
     * Checks that the record can be proposed as a candidate.
     *
     * @throws InvalidRecordException if the external id is missing
     */
    public void validate() {
        if (externalId == null || externalId.isBlank()) {
            throw new InvalidRecordException(externalId, "directory record '" + name + "' has no external id");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CandidateRecord that = (CandidateRecord) o;
        return Objects.equals(externalId, that.externalId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(externalId);
    }

    @Override
    public String toString() {
        return "CandidateRecord{" +
                "externalId='" + externalId + '\'' +
                ", name='" + name + '\'' +
                ", emails=" + emails.size() +
                ", phones=" + phones.size() +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String externalId;
        private String name;
        private final Set<String> emails = new LinkedHashSet<>();
        private final Set<String> phones = new LinkedHashSet<>();
        private String status;

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder email(String email) {
            addIfPresent(emails, email);
            return this;
        }

        public Builder emails(Collection<String> emails) {
            if (emails != null) {
                emails.forEach(this::email);
            }
            return this;
        }

        public Builder phone(String phone) {
            addIfPresent(phones, phone);
            return this;
        }

        public Builder phones(Collection<String> phones) {
            if (phones != null) {
                phones.forEach(this::phone);
            }
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public CandidateRecord build() {
            return new CandidateRecord(this);
        }

        private static void addIfPresent(Set<String> target, String value) {
            if (value != null && !value.isBlank()) {
                target.add(value.trim());
            }
        }
    }
}
