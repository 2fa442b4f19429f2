package eu.virtualparadox.termcontext.application;

import eu.virtualparadox.termcontext.cache.ContextCache;
import eu.virtualparadox.termcontext.context.BatchContextService;
import eu.virtualparadox.termcontext.context.CombinedContextService;
import eu.virtualparadox.termcontext.context.FoodContextAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Command-line entry: non-option arguments are the query terms, {@code --source} picks the path.
 * <pre>
 *   java -jar term-context.jar --source=combined aspirin ibuprofen
 * </pre>
 * The food-data beans are only requested for the {@code food} and {@code combined} sources, so a
 * literature run does not need the FoodData credential.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContextCommandRunner implements ApplicationRunner {

    enum Source { LITERATURE, FOOD, COMBINED }

    private final BatchContextService batchContextService;
    private final ObjectProvider<FoodContextAggregator> foodContextAggregator;
    private final ObjectProvider<CombinedContextService> combinedContextService;
    private final ContextCache contextCache;

    @Override
    public void run(final ApplicationArguments args) {
        final List<String> terms = args.getNonOptionArgs();
        if (terms.isEmpty()) {
            log.info("No query terms given. Usage: [--source=literature|food|combined] <term> [<term> ...]");
            return;
        }

        final Source source = parseSource(args.getOptionValues("source"));
        log.info("Fetching {} context for {} terms", source.name().toLowerCase(Locale.ROOT), terms.size());

        final String context = switch (source) {
            case LITERATURE -> batchContextService.fetchContext(terms);
            case FOOD -> foodContextAggregator.getObject().aggregate(terms);
            case COMBINED -> combinedContextService.getObject().fetch(terms);
        };

        System.out.println(context);
        log.debug("Context cache after run: {}", contextCache.stats());
    }

    static Source parseSource(final List<String> values) {
        if (values == null || values.isEmpty()) {
            return Source.LITERATURE;
        }
        try {
            return Source.valueOf(values.get(0).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown --source '" + values.get(0)
                    + "', expected literature, food or combined", e);
        }
    }
}
