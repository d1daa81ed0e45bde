package in.co.vedicwisdom.services;

import com.google.gson.JsonObject;

/**
 * Receives one self-describing record per digest or janam patri run. Storage is up to the implementation.
 */
public interface RecommendationSink {

    void emit(JsonObject record);
}
