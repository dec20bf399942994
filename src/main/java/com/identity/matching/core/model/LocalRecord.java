package com.identity.matching.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A locally captured person awaiting linkage to a directory entry.
 * Owned by the record store; the engine only reads it.
 *
 * <p>The builder accepts incomplete data so that a malformed record coming
 * from the store can still be represented and rejected individually through
 * {@link #validate()}.</p>
 */
public final class LocalRecord {
    private final String id;
    private final String firstName;
    private final String lastName;
    private final String email;
    private final String phone;
    private final String externalReference;

    private LocalRecord(Builder builder) {
        this.id = builder.id;
        this.firstName = builder.firstName;
        this.lastName = builder.lastName;
        this.email = blankToNull(builder.email);
        this.phone = blankToNull(builder.phone);
        this.externalReference = blankToNull(builder.externalReference);
    }

    public String getId() {
        return id;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    /**
     * Returns trim(first + " " + last), treating missing parts as empty.
     */
    public String getFullName() {
        String first = firstName != null ? firstName : "";
        String last = lastName != null ? lastName : "";
        return (first + " " + last).trim();
    }

    public Optional<String> getEmail() {
        return Optional.ofNullable(email);
    }

    public Optional<String> getPhone() {
        return Optional.ofNullable(phone);
    }

    public Optional<String> getExternalReference() {
        return Optional.ofNullable(externalReference);
    }

    public boolean hasEmail() {
        return email != null;
    }

    public boolean hasPhone() {
        return phone != null;
    }

    public boolean isLinked() {
        return externalReference != null;
    }

    /**
     * Checks that the record can take part in matching.
     *
     * @throws InvalidRecordException if the id or the full name is missing
     */
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new InvalidRecordException(id, "local record has no id");
        }
        if (getFullName().isEmpty()) {
            throw new InvalidRecordException(id, "local record " + id + " has no name");
        }
    }

    /**
     * Returns a copy of this record linked to the given external id.
     */
    public LocalRecord withExternalReference(String externalId) {
        return toBuilder().externalReference(externalId).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .firstName(firstName)
                .lastName(lastName)
                .email(email)
                .phone(phone)
                .externalReference(externalReference);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LocalRecord that = (LocalRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "LocalRecord{" +
                "id='" + id + '\'' +
                ", name='" + getFullName() + '\'' +
                ", linked=" + isLinked() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String firstName;
        private String lastName;
        private String email;
        private String phone;
        private String externalReference;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder externalReference(String externalReference) {
            this.externalReference = externalReference;
            return this;
        }

        public LocalRecord build() {
            return new LocalRecord(this);
        }
    }
}
