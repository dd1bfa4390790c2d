package com.property.linkage.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a niche list or skip-trace file. Immutable.
 *
 * <p>{@code sourceType} names the dataset's source (e.g. {@code Liens}); {@code enrichmentTags}
 * are the tags the row contributes. A niche row contributes its source type; a skip-trace
 * row contributes zero or more detected distress flags.</p>
 */
public final class SecondaryRecord {
    private final DatasetKind kind;
    private final String sourceType;
    private final List<String> enrichmentTags;
    private final String address;
    private final String city;
    private final String state;
    private final String zip;
    private final String jurisdictionCode;
    private final String structuredId;
    private final String ownerName;
    private final String mailingAddress;
    private final String lastSaleDate;
    private final String lastSaleAmount;
    private final GoldenContact goldenContact;
    private final long lineNumber;
    private final Map<String, String> sourceColumns;

    private SecondaryRecord(Builder builder) {
        this.kind = builder.kind;
        this.sourceType = builder.sourceType;
        this.enrichmentTags = builder.enrichmentTags != null
                ? List.copyOf(builder.enrichmentTags)
                : (builder.kind == DatasetKind.NICHE ? List.of(builder.sourceType) : List.of());
        this.address = builder.address;
        this.city = builder.city;
        this.state = builder.state;
        this.zip = builder.zip;
        this.jurisdictionCode = builder.jurisdictionCode;
        this.structuredId = builder.structuredId;
        this.ownerName = builder.ownerName;
        this.mailingAddress = builder.mailingAddress;
        this.lastSaleDate = builder.lastSaleDate;
        this.lastSaleAmount = builder.lastSaleAmount;
        this.goldenContact = builder.goldenContact;
        this.lineNumber = builder.lineNumber;
        this.sourceColumns = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sourceColumns));
    }

    public DatasetKind getKind() {
        return kind;
    }

    public String getSourceType() {
        return sourceType;
    }

    public List<String> getEnrichmentTags() {
        return enrichmentTags;
    }

    public String getAddress() {
        return address;
    }

    public String getCity() {
        return city;
    }

    public String getState() {
        return state;
    }

    public String getZip() {
        return zip;
    }

    public String getJurisdictionCode() {
        return jurisdictionCode;
    }

    public String getStructuredId() {
        return structuredId;
    }

    public String getOwnerName() {
        return ownerName;
    }

    public String getMailingAddress() {
        return mailingAddress;
    }

    public String getLastSaleDate() {
        return lastSaleDate;
    }

    public String getLastSaleAmount() {
        return lastSaleAmount;
    }

    /**
     * Verified contact for skip-trace rows; null for niche rows.
     */
    public GoldenContact getGoldenContact() {
        return goldenContact;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public Map<String, String> getSourceColumns() {
        return sourceColumns;
    }

    @Override
    public String toString() {
        return "SecondaryRecord{" +
                "kind=" + kind +
                ", sourceType='" + sourceType + '\'' +
                ", address='" + address + '\'' +
                ", jurisdictionCode='" + jurisdictionCode + '\'' +
                ", line=" + lineNumber +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DatasetKind kind = DatasetKind.NICHE;
        private String sourceType;
        private List<String> enrichmentTags;
        private String address;
        private String city;
        private String state;
        private String zip;
        private String jurisdictionCode;
        private String structuredId;
        private String ownerName;
        private String mailingAddress;
        private String lastSaleDate;
        private String lastSaleAmount;
        private GoldenContact goldenContact;
        private long lineNumber;
        private final Map<String, String> sourceColumns = new LinkedHashMap<>();

        public Builder kind(DatasetKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder sourceType(String sourceType) {
            this.sourceType = sourceType;
            return this;
        }

        public Builder enrichmentTags(List<String> enrichmentTags) {
            this.enrichmentTags = enrichmentTags;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder zip(String zip) {
            this.zip = zip;
            return this;
        }

        public Builder jurisdictionCode(String jurisdictionCode) {
            this.jurisdictionCode = jurisdictionCode;
            return this;
        }

        public Builder structuredId(String structuredId) {
            this.structuredId = structuredId;
            return this;
        }

        public Builder ownerName(String ownerName) {
            this.ownerName = ownerName;
            return this;
        }

        public Builder mailingAddress(String mailingAddress) {
            this.mailingAddress = mailingAddress;
            return this;
        }

        public Builder lastSaleDate(String lastSaleDate) {
            this.lastSaleDate = lastSaleDate;
            return this;
        }

        public Builder lastSaleAmount(String lastSaleAmount) {
            this.lastSaleAmount = lastSaleAmount;
            return this;
        }

        public Builder goldenContact(GoldenContact goldenContact) {
            this.goldenContact = goldenContact;
            return this;
        }

        public Builder lineNumber(long lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder sourceColumns(Map<String, String> columns) {
            this.sourceColumns.clear();
            if (columns != null) {
                this.sourceColumns.putAll(columns);
            }
            return this;
        }

        public SecondaryRecord build() {
            Objects.requireNonNull(kind, "kind is required");
            Objects.requireNonNull(sourceType, "sourceType is required");
            return new SecondaryRecord(this);
        }
    }
}
