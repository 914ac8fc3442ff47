package net.lexiconnect.services;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import net.lexiconnect.model.StatisticsModel;

import java.util.ArrayList;
import java.util.List;

/**
 * What an import stored: the dataset it was filed under, the IDs of its texts and
 * statistics over them.
 */
@JsonPropertyOrder({"dataset_id", "file", "text_ids", "statistics"})
public class IngestResult {
    private final String datasetId;
    private final String file;
    private final List<String> textIds;
    private final StatisticsModel statistics;

    public IngestResult(String datasetId, String file, List<String> textIds, StatisticsModel statistics) {
        this.datasetId = datasetId;
        this.file = file;
        this.textIds = new ArrayList<>(textIds);
        this.statistics = statistics;
    }

    @JsonProperty("dataset_id")
    public String getDatasetId() {
        return datasetId;
    }

    public String getFile() {
        return file;
    }

    @JsonProperty("text_ids")
    public List<String> getTextIds() {
        return textIds;
    }

    public StatisticsModel getStatistics() {
        return statistics;
    }
}
