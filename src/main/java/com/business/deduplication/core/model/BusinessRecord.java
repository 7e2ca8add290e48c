package com.business.deduplication.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A business record submitted for deduplication.
 *
 * <p>Instances are immutable. Blank strings are stored as {@code null} so that
 * missing data is always "absent" and never an empty value. The builder does not
 * reject a missing id or name: such records are reported as data quality issues
 * by the engine rather than failing at construction time.</p>
 */
public final class BusinessRecord {
    private final String id;
    private final String name;
    private final String businessType;
    private final String businessNumber;
    private final String phone;
    private final String email;
    private final String website;
    private final Address address;
    private final String description;
    private final Set<String> industry;
    private final Double confidence;
    private final boolean verified;

    private BusinessRecord(Builder builder) {
        this.id = blankToNull(builder.id);
        this.name = blankToNull(builder.name);
        this.businessType = blankToNull(builder.businessType);
        this.businessNumber = blankToNull(builder.businessNumber);
        this.phone = blankToNull(builder.phone);
        this.email = blankToNull(builder.email);
        this.website = blankToNull(builder.website);
        this.address = builder.address == null || builder.address.isEmpty() ? null : builder.address;
        this.description = blankToNull(builder.description);
        this.industry = Collections.unmodifiableSet(new LinkedHashSet<>(builder.industry));
        this.confidence = builder.confidence;
        this.verified = builder.verified;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getBusinessType() {
        return businessType;
    }

    public String getBusinessNumber() {
        return businessNumber;
    }

    public String getPhone() {
        return phone;
    }

    public String getEmail() {
        return email;
    }

    public String getWebsite() {
        return website;
    }

    public Address getAddress() {
        return address;
    }

    public String getDescription() {
        return description;
    }

    public Set<String> getIndustry() {
        return industry;
    }

    public Double getConfidence() {
        return confidence;
    }

    public boolean isVerified() {
        return verified;
    }

    public boolean hasId() {
        return id != null;
    }

    /**
     * Returns a builder pre-populated with this record's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .businessType(businessType)
                .businessNumber(businessNumber)
                .phone(phone)
                .email(email)
                .website(website)
                .address(address)
                .description(description)
                .industry(industry)
                .confidence(confidence)
                .verified(verified);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BusinessRecord that = (BusinessRecord) o;
        return verified == that.verified
                && Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(businessType, that.businessType)
                && Objects.equals(businessNumber, that.businessNumber)
                && Objects.equals(phone, that.phone)
                && Objects.equals(email, that.email)
                && Objects.equals(website, that.website)
                && Objects.equals(address, that.address)
                && Objects.equals(description, that.description)
                && Objects.equals(industry, that.industry)
                && Objects.equals(confidence, that.confidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, businessType, businessNumber, phone, email, website,
                address, description, industry, confidence, verified);
    }

    @Override
    public String toString() {
        return "BusinessRecord{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                (businessNumber != null ? ", businessNumber='" + businessNumber + '\'' : "") +
                (phone != null ? ", phone='" + phone + '\'' : "") +
                (email != null ? ", email='" + email + '\'' : "") +
                (website != null ? ", website='" + website + '\'' : "") +
                (confidence != null ? ", confidence=" + confidence : "") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static class Builder {
        private String id;
        private String name;
        private String businessType;
        private String businessNumber;
        private String phone;
        private String email;
        private String website;
        private Address address;
        private String description;
        private final Set<String> industry = new LinkedHashSet<>();
        private Double confidence;
        private boolean verified;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder businessType(String businessType) {
            this.businessType = businessType;
            return this;
        }

        public Builder businessNumber(String businessNumber) {
            this.businessNumber = businessNumber;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder address(Address address) {
            this.address = address;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder industry(Collection<String> tags) {
            this.industry.clear();
            if (tags != null) {
                for (String tag : tags) {
                    if (tag != null && !tag.isBlank()) {
                        this.industry.add(tag.trim());
                    }
                }
            }
            return this;
        }

        public Builder industry(String... tags) {
            return industry(tags == null ? null : Arrays.asList(tags));
        }

        public Builder confidence(Double confidence) {
            if (confidence != null && (confidence < 0.0 || confidence > 1.0 || confidence.isNaN())) {
                throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
            }
            this.confidence = confidence;
            return this;
        }

        public Builder verified(boolean verified) {
            this.verified = verified;
            return this;
        }

        public BusinessRecord build() {
            return new BusinessRecord(this);
        }
    }
}
