package net.lexiconnect.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The raw content of an ELAN .eaf file: header information, the time slot table and
 * the tiers. This is what the ELAN parser reads before it reconstructs a text.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"file", "author", "date", "media", "time_slots", "tiers"})
public class ElanDocumentModel {
    private String file;
    private String author;
    private String date;
    /**
     * The attributes of each MEDIA_DESCRIPTOR in the header
     */
    private List<Map<String, String>> media = new ArrayList<>();
    /**
     * TIME_SLOT_ID -> milliseconds
     */
    private LinkedHashMap<String, Long> timeSlots = new LinkedHashMap<>();
    private List<ElanTierModel> tiers = new ArrayList<>();

    public ElanDocumentModel() {}

    public ElanDocumentModel(String file) {
        this.file = file;
    }

    @JsonIgnore
    public ElanTierModel getTier(String tierId) {
        for (ElanTierModel t : tiers)
            if (t.getId().equals(tierId))
                return t;
        return null;
    }

    @JsonIgnore
    public int getAnnotationCount() {
        return tiers.stream().mapToInt(t -> t.getAnnotations().size()).sum();
    }

    @JsonIgnore
    public int getAlignableCount() {
        return tiers.stream().mapToInt(t -> t.getAlignableAnnotations().size()).sum();
    }

    @JsonIgnore
    public int getReferenceCount() {
        return getAnnotationCount() - getAlignableCount();
    }

    public String getFile() {
        return file;
    }
    public void setFile(String file) {
        this.file = file;
    }
    public String getAuthor() {
        return author;
    }
    public void setAuthor(String author) {
        this.author = author;
    }
    public String getDate() {
        return date;
    }
    public void setDate(String date) {
        this.date = date;
    }
    public List<Map<String, String>> getMedia() {
        return media;
    }
    public void setMedia(List<Map<String, String>> media) {
        this.media = media;
    }
    @JsonProperty("time_slots")
    public LinkedHashMap<String, Long> getTimeSlots() {
        return timeSlots;
    }
    public void setTimeSlots(LinkedHashMap<String, Long> timeSlots) {
        this.timeSlots = timeSlots;
    }
    public List<ElanTierModel> getTiers() {
        return tiers;
    }
    public void setTiers(List<ElanTierModel> tiers) {
        this.tiers = tiers;
    }
}
