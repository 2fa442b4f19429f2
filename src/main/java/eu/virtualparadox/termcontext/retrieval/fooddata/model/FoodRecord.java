package eu.virtualparadox.termcontext.retrieval.fooddata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One food from a FoodData Central search.
 *
 * @param description   Primary descriptive field; a record without it yields no summary.
 * @param brandOwner    Brand/owner, absent for generic foods.
 * @param foodNutrients Reported nutrients in API order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FoodRecord(String description, String brandOwner, List<FoodNutrient> foodNutrients) {

    public static final String UNKNOWN_BRAND = "Unknown brand";
    static final int SUMMARY_NUTRIENTS = 3;

    /**
     * Reduces the record to one line for the prompt context:
     * {@code "<description> (Brand: <brand>). Key nutrients: <n1>, <n2>, <n3>."}
     *
     * @return the summary, or empty when the record has no description
     */
    public Optional<String> summary() {
        if (StringUtils.isBlank(description)) {
            return Optional.empty();
        }
        final String brand = StringUtils.isBlank(brandOwner) ? UNKNOWN_BRAND : brandOwner;
        final String nutrients = foodNutrients == null ? "" : foodNutrients.stream()
                .limit(SUMMARY_NUTRIENTS)
                .filter(n -> n != null && StringUtils.isNotBlank(n.nutrientName()))
                .map(FoodNutrient::describe)
                .collect(Collectors.joining(", "));
        return Optional.of(description + " (Brand: " + brand + "). Key nutrients: " + nutrients + ".");
    }
}
