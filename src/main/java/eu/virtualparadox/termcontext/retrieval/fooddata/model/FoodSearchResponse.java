package eu.virtualparadox.termcontext.retrieval.fooddata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * @param totalHits Total number of matches reported by the API.
 * @param foods     Requested page of matches, best first.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FoodSearchResponse(Integer totalHits, List<FoodRecord> foods) {

}
