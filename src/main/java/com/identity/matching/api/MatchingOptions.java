package com.identity.matching.api;

import java.time.Duration;

/**
 * Options for matching runs: comparison thresholds, directory fetch limits and parallelism.
 */
public class MatchingOptions {

    private static final double DEFAULT_FAMILY_NAME_THRESHOLD = 0.90;
    private static final double DEFAULT_GIVEN_NAME_PERFECT_THRESHOLD = 0.95;
    private static final double DEFAULT_GIVEN_NAME_CLOSE_THRESHOLD = 0.85;
    private static final double DEFAULT_FULL_NAME_PERFECT_THRESHOLD = 0.95;
    private static final double DEFAULT_FULL_NAME_CLOSE_THRESHOLD = 0.85;
    private static final double DEFAULT_EMAIL_DOMAIN_THRESHOLD = 0.80;
    private static final int DEFAULT_PHONE_SUFFIX_LENGTH = 7;
    private static final int DEFAULT_DIRECTORY_PAGE_SIZE = 100;
    private static final int DEFAULT_DIRECTORY_MAX_PAGES = 100;
    private static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofMinutes(5);
    private static final int DEFAULT_PARALLELISM = 1;

    private final double familyNameThreshold;
    private final double givenNamePerfectThreshold;
    private final double givenNameCloseThreshold;
    private final double fullNamePerfectThreshold;
    private final double fullNameCloseThreshold;
    private final double emailDomainThreshold;
    private final int phoneSuffixLength;
    private final int directoryPageSize;
    private final int directoryMaxPages;
    private final Duration fetchTimeout;
    private final int parallelism;

    private MatchingOptions(Builder builder) {
        this.familyNameThreshold = builder.familyNameThreshold;
        this.givenNamePerfectThreshold = builder.givenNamePerfectThreshold;
        this.givenNameCloseThreshold = builder.givenNameCloseThreshold;
        this.fullNamePerfectThreshold = builder.fullNamePerfectThreshold;
        this.fullNameCloseThreshold = builder.fullNameCloseThreshold;
        this.emailDomainThreshold = builder.emailDomainThreshold;
        this.phoneSuffixLength = builder.phoneSuffixLength;
        this.directoryPageSize = builder.directoryPageSize;
        this.directoryMaxPages = builder.directoryMaxPages;
        this.fetchTimeout = builder.fetchTimeout;
        this.parallelism = builder.parallelism;
    }

    /**
     * Minimum family-name similarity before given names are compared token by token.
     */
    public double getFamilyNameThreshold() {
        return familyNameThreshold;
    }

    public double getGivenNamePerfectThreshold() {
        return givenNamePerfectThreshold;
    }

    public double getGivenNameCloseThreshold() {
        return givenNameCloseThreshold;
    }

    public double getFullNamePerfectThreshold() {
        return fullNamePerfectThreshold;
    }

    public double getFullNameCloseThreshold() {
        return fullNameCloseThreshold;
    }

    /**
     * Minimum domain similarity for two emails with the same local part to count as close.
     */
    public double getEmailDomainThreshold() {
        return emailDomainThreshold;
    }

    /**
     * Number of trailing digits compared when two phone numbers differ.
     */
    public int getPhoneSuffixLength() {
        return phoneSuffixLength;
    }

    public int getDirectoryPageSize() {
        return directoryPageSize;
    }

    /**
     * Upper bound on directory pages fetched per run.
     */
    public int getDirectoryMaxPages() {
        return directoryMaxPages;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    /**
     * Number of threads used to match local records; 1 matches on the caller's thread.
     */
    public int getParallelism() {
        return parallelism;
    }

    public static MatchingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double familyNameThreshold = DEFAULT_FAMILY_NAME_THRESHOLD;
        private double givenNamePerfectThreshold = DEFAULT_GIVEN_NAME_PERFECT_THRESHOLD;
        private double givenNameCloseThreshold = DEFAULT_GIVEN_NAME_CLOSE_THRESHOLD;
        private double fullNamePerfectThreshold = DEFAULT_FULL_NAME_PERFECT_THRESHOLD;
        private double fullNameCloseThreshold = DEFAULT_FULL_NAME_CLOSE_THRESHOLD;
        private double emailDomainThreshold = DEFAULT_EMAIL_DOMAIN_THRESHOLD;
        private int phoneSuffixLength = DEFAULT_PHONE_SUFFIX_LENGTH;
        private int directoryPageSize = DEFAULT_DIRECTORY_PAGE_SIZE;
        private int directoryMaxPages = DEFAULT_DIRECTORY_MAX_PAGES;
        private Duration fetchTimeout = DEFAULT_FETCH_TIMEOUT;
        private int parallelism = DEFAULT_PARALLELISM;

        public Builder familyNameThreshold(double familyNameThreshold) {
            validateThreshold(familyNameThreshold, "familyNameThreshold");
            this.familyNameThreshold = familyNameThreshold;
            return this;
        }

        public Builder givenNamePerfectThreshold(double givenNamePerfectThreshold) {
            validateThreshold(givenNamePerfectThreshold, "givenNamePerfectThreshold");
            this.givenNamePerfectThreshold = givenNamePerfectThreshold;
            return this;
        }

        public Builder givenNameCloseThreshold(double givenNameCloseThreshold) {
            validateThreshold(givenNameCloseThreshold, "givenNameCloseThreshold");
            this.givenNameCloseThreshold = givenNameCloseThreshold;
            return this;
        }

        public Builder fullNamePerfectThreshold(double fullNamePerfectThreshold) {
            validateThreshold(fullNamePerfectThreshold, "fullNamePerfectThreshold");
            this.fullNamePerfectThreshold = fullNamePerfectThreshold;
            return this;
        }

        public Builder fullNameCloseThreshold(double fullNameCloseThreshold) {
            validateThreshold(fullNameCloseThreshold, "fullNameCloseThreshold");
            this.fullNameCloseThreshold = fullNameCloseThreshold;
            return this;
        }

        public Builder emailDomainThreshold(double emailDomainThreshold) {
            validateThreshold(emailDomainThreshold, "emailDomainThreshold");
            this.emailDomainThreshold = emailDomainThreshold;
            return this;
        }

        public Builder phoneSuffixLength(int phoneSuffixLength) {
            if (phoneSuffixLength <= 0) {
                throw new IllegalArgumentException("phoneSuffixLength must be positive");
            }
            this.phoneSuffixLength = phoneSuffixLength;
            return this;
        }

        public Builder directoryPageSize(int directoryPageSize) {
            if (directoryPageSize <= 0) {
                throw new IllegalArgumentException("directoryPageSize must be positive");
            }
            this.directoryPageSize = directoryPageSize;
            return this;
        }

        public Builder directoryMaxPages(int directoryMaxPages) {
            if (directoryMaxPages <= 0) {
                throw new IllegalArgumentException("directoryMaxPages must be positive");
            }
            this.directoryMaxPages = directoryMaxPages;
            return this;
        }

        public Builder fetchTimeout(Duration fetchTimeout) {
            if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()) {
                throw new IllegalArgumentException("fetchTimeout must be positive");
            }
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public MatchingOptions build() {
            if (givenNamePerfectThreshold < givenNameCloseThreshold) {
                throw new IllegalArgumentException(
                        "givenNamePerfectThreshold must be >= givenNameCloseThreshold");
            }
            if (fullNamePerfectThreshold < fullNameCloseThreshold) {
                throw new IllegalArgumentException(
                        "fullNamePerfectThreshold must be >= fullNameCloseThreshold");
            }
            return new MatchingOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "MatchingOptions{" +
                "familyNameThreshold=" + familyNameThreshold +
                ", givenNamePerfectThreshold=" + givenNamePerfectThreshold +
                ", givenNameCloseThreshold=" + givenNameCloseThreshold +
                ", fullNamePerfectThreshold=" + fullNamePerfectThreshold +
                ", fullNameCloseThreshold=" + fullNameCloseThreshold +
                ", emailDomainThreshold=" + emailDomainThreshold +
                ", phoneSuffixLength=" + phoneSuffixLength +
                ", directoryPageSize=" + directoryPageSize +
                ", directoryMaxPages=" + directoryMaxPages +
                ", fetchTimeout=" + fetchTimeout +
                ", parallelism=" + parallelism +
                '}';
    }
}
