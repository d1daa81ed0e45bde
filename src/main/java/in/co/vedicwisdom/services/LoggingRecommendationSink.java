package in.co.vedicwisdom.services;

import com.google.gson.JsonObject;

import java.util.Map;

/**
 * Writes recommendation records to the structured log, where CloudWatch Logs Insights can query them.
 */
public class LoggingRecommendationSink implements RecommendationSink {

    @Override
    public void emit(JsonObject record) {
        String kind = record.has("kind") ? record.get("kind").getAsString() : "unknown";
        String recordId = record.has("record_id") ? record.get("record_id").getAsString() : "";
        LoggingService.info("recommendation_record", Map.of(
                "kind", kind,
                "recordId", recordId,
                "record", record.toString()));
    }
}
