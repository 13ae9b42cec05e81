package com.pedromossi.clinicache.clinic;

import java.util.Objects;

/**
 * Cacheable projection of a screening type definition.
 *
 * <p>Keyword and condition fields keep the raw text stored with the screening type
 * (comma separated or JSON, depending on how it was entered).</p>
 */
public class ScreeningTypeSummary {

    private Long id;
    private String name;
    private boolean active = true;
    private String description = "";
    private String defaultFrequency = "";
    private Integer frequencyNumber;
    private String frequencyUnit;
    private String keywords = "";
    private String triggerConditions = "";
    private Integer minAge;
    private Integer maxAge;
    private String genderSpecific;
    private String documentTypes = "";
    private String filenameKeywords = "";
    private String contentKeywords = "";

    public ScreeningTypeSummary() {
    }

    public ScreeningTypeSummary(Long id, String name, boolean active) {
        this.id = id;
        this.name = name;
        this.active = active;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getDefaultFrequency() {
        return defaultFrequency;
    }

    public void setDefaultFrequency(String defaultFrequency) {
        this.defaultFrequency = defaultFrequency;
    }

    public Integer getFrequencyNumber() {
        return frequencyNumber;
    }

    public void setFrequencyNumber(Integer frequencyNumber) {
        this.frequencyNumber = frequencyNumber;
    }

    public String getFrequencyUnit() {
        return frequencyUnit;
    }

    public void setFrequencyUnit(String frequencyUnit) {
        this.frequencyUnit = frequencyUnit;
    }

    public String getKeywords() {
        return keywords;
    }

    public void setKeywords(String keywords) {
        this.keywords = keywords;
    }

    public String getTriggerConditions() {
        return triggerConditions;
    }

    public void setTriggerConditions(String triggerConditions) {
        this.triggerConditions = triggerConditions;
    }

    public Integer getMinAge() {
        return minAge;
    }

    public void setMinAge(Integer minAge) {
        this.minAge = minAge;
    }

    public Integer getMaxAge() {
        return maxAge;
    }

    public void setMaxAge(Integer maxAge) {
        this.maxAge = maxAge;
    }

    public String getGenderSpecific() {
        return genderSpecific;
    }

    public void setGenderSpecific(String genderSpecific) {
        this.genderSpecific = genderSpecific;
    }

    public String getDocumentTypes() {
        return documentTypes;
    }

    public void setDocumentTypes(String documentTypes) {
        this.documentTypes = documentTypes;
    }

    public String getFilenameKeywords() {
        return filenameKeywords;
    }

    public void setFilenameKeywords(String filenameKeywords) {
        this.filenameKeywords = filenameKeywords;
    }

    public String getContentKeywords() {
        return contentKeywords;
    }

    public void setContentKeywords(String contentKeywords) {
        this.contentKeywords = contentKeywords;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScreeningTypeSummary that)) {
            return false;
        }
        return active == that.active && Objects.equals(id, that.id) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, active);
    }

    @Override
    public String toString() {
        return "ScreeningTypeSummary{id=" + id + ", name='" + name + "', active=" + active + '}';
    }
}
