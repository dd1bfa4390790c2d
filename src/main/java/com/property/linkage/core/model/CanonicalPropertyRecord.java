package com.property.linkage.core.model;

import com.property.linkage.rules.KeyNormalizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One row of the property registry.
 * Identity, owner and classification fields are fixed at load time; enrichment state
 * (tags, composite priority, golden contact) is mutated in place by linkage passes.
 */
public class CanonicalPropertyRecord {
    private final String id;
    private final String address;
    private final String normalizedAddressKey;
    private final String city;
    private final String state;
    private final String zip;
    private final String jurisdictionCode;
    private final String structuredId;
    private final String ownerName;
    private final String mailingAddress;
    private final String lastSaleDate;
    private final String lastSaleAmount;
    private final PropertyCategory propertyCategory;
    private final BaseClassification baseClassification;
    private final BasePriority basePriority;
    private final boolean nicheOnly;
    private final Map<String, String> sourceColumns;

    private final Set<String> accumulatedTags = new LinkedHashSet<>();
    private String compositePriorityCode;
    private String compositePriorityName;
    private String goldenAddress;
    private String goldenCity;
    private String goldenState;
    private String goldenZip;
    private boolean goldenAddressDiffers;

    private CanonicalPropertyRecord(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.address = builder.address;
        this.normalizedAddressKey = KeyNormalizer.normalizeAddress(builder.address);
        this.city = builder.city;
        this.state = builder.state;
        this.zip = builder.zip;
        this.jurisdictionCode = builder.jurisdictionCode;
        this.structuredId = builder.structuredId;
        this.ownerName = builder.ownerName;
        this.mailingAddress = builder.mailingAddress;
        this.lastSaleDate = builder.lastSaleDate;
        this.lastSaleAmount = builder.lastSaleAmount;
        this.propertyCategory = builder.propertyCategory != null
                ? builder.propertyCategory : PropertyCategory.DEVELOPED;
        this.baseClassification = builder.baseClassification != null
                ? builder.baseClassification : BaseClassification.none();
        this.basePriority = builder.basePriority;
        this.nicheOnly = builder.nicheOnly;
        this.sourceColumns = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sourceColumns));
        this.compositePriorityCode = basePriority.code();
        this.compositePriorityName = basePriority.name();
    }

    public String getId() {
        return id;
    }

    public String getAddress() {
        return address;
    }

    /**
     * Normalized address used as the address component of every matching key.
     */
    public String getNormalizedAddressKey() {
        return normalizedAddressKey;
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

    public PropertyCategory getPropertyCategory() {
        return propertyCategory;
    }

    public BaseClassification getBaseClassification() {
        return baseClassification;
    }

    public BasePriority getBasePriority() {
        return basePriority;
    }

    /**
     * True for records synthesized from an unmatched niche-list row.
     */
    public boolean isNicheOnly() {
        return nicheOnly;
    }

    /**
     * Input columns carried through unchanged to output, in input order.
     */
    public Map<String, String> getSourceColumns() {
        return sourceColumns;
    }

    public List<String> getAccumulatedTags() {
        return List.copyOf(accumulatedTags);
    }

    public boolean hasTag(String tag) {
        return accumulatedTags.contains(tag);
    }

    /**
     * True if the record already reflects the given source, either as an accumulated tag
     * or, for niche-only records, as the source its base priority was synthesized from.
     */
    public boolean carriesTag(String tag) {
        return accumulatedTags.contains(tag) || (nicheOnly && basePriority.code().equals(tag));
    }

    /**
     * Appends a tag in application order.
     *
     * @return false if the tag was already present
     */
    public boolean addTag(String tag) {
        Objects.requireNonNull(tag, "tag is required");
        return accumulatedTags.add(tag);
    }

    public String getCompositePriorityCode() {
        return compositePriorityCode;
    }

    public String getCompositePriorityName() {
        return compositePriorityName;
    }

    public void setCompositePriority(String code, String name) {
        this.compositePriorityCode = Objects.requireNonNull(code, "code is required");
        this.compositePriorityName = Objects.requireNonNull(name, "name is required");
    }

    public String getGoldenAddress() {
        return goldenAddress;
    }

    public void setGoldenAddress(String goldenAddress) {
        this.goldenAddress = goldenAddress;
    }

    public String getGoldenCity() {
        return goldenCity;
    }

    public void setGoldenCity(String goldenCity) {
        this.goldenCity = goldenCity;
    }

    public String getGoldenState() {
        return goldenState;
    }

    public void setGoldenState(String goldenState) {
        this.goldenState = goldenState;
    }

    public String getGoldenZip() {
        return goldenZip;
    }

    public void setGoldenZip(String goldenZip) {
        this.goldenZip = goldenZip;
    }

    public boolean isGoldenAddressDiffers() {
        return goldenAddressDiffers;
    }

    public void setGoldenAddressDiffers(boolean goldenAddressDiffers) {
        this.goldenAddressDiffers = goldenAddressDiffers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalPropertyRecord that = (CanonicalPropertyRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CanonicalPropertyRecord{" +
                "address='" + address + '\'' +
                ", city='" + city + '\'' +
                ", jurisdictionCode='" + jurisdictionCode + '\'' +
                ", compositePriorityCode='" + compositePriorityCode + '\'' +
                ", tags=" + accumulatedTags +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
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
        private PropertyCategory propertyCategory;
        private BaseClassification baseClassification;
        private BasePriority basePriority;
        private boolean nicheOnly;
        private final Map<String, String> sourceColumns = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
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

        public Builder propertyCategory(PropertyCategory propertyCategory) {
            this.propertyCategory = propertyCategory;
            return this;
        }

        public Builder baseClassification(BaseClassification baseClassification) {
            this.baseClassification = baseClassification;
            return this;
        }

        public Builder basePriority(BasePriority basePriority) {
            this.basePriority = basePriority;
            return this;
        }

        public Builder nicheOnly(boolean nicheOnly) {
            this.nicheOnly = nicheOnly;
            return this;
        }

        public Builder sourceColumns(Map<String, String> columns) {
            this.sourceColumns.clear();
            if (columns != null) {
                this.sourceColumns.putAll(columns);
            }
            return this;
        }

        public CanonicalPropertyRecord build() {
            Objects.requireNonNull(basePriority, "basePriority is required");
            return new CanonicalPropertyRecord(this);
        }
    }
}
