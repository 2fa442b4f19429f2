package eu.virtualparadox.termcontext.context;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Food-data summaries followed by literature context, the blob handed to the summarization step.
 */
@Service
@Lazy
@Slf4j
@RequiredArgsConstructor
public class CombinedContextService {

    static final String SECTION_SEPARATOR = "\n\n";

    private final FoodContextAggregator foodContextAggregator;
    private final BatchContextService batchContextService;

    public String fetch(final List<String> terms) {
        final String foodContext = foodContextAggregator.aggregate(terms);
        final String literatureContext = batchContextService.fetchContext(terms);
        log.debug("Combined context: {} chars of food data, {} chars of literature",
                foodContext.length(), literatureContext.length());
        return foodContext + SECTION_SEPARATOR + literatureContext;
    }
}
