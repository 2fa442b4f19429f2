package eu.virtualparadox.termcontext.retrieval.fooddata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

/**
 * @param nutrientName Display name, e.g. "Protein".
 * @param value        Amount per 100 g, as reported.
 * @param unitName     Unit of {@code value}, e.g. "G" or "KCAL".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FoodNutrient(String nutrientName, BigDecimal value, String unitName) {

    /**
     * @return {@code "<name>: <value> <unit>"}
     */
    public String describe() {
        final String amount = value == null ? "" : value.toPlainString();
        return nutrientName + ": " + amount + " " + (unitName == null ? "" : unitName);
    }
}
