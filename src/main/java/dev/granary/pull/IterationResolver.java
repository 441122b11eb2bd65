package dev.granary.pull;

import dev.granary.source.DottedPath;
import dev.granary.source.IterationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the items an iterating pull runs over.
 *
 * <p>The items come from a tool exposed by another service, reached through service invocation
 * ({@code POST /invoke/{app}/method/tools/{tool}} with the tool arguments as body). The list is
 * either the response itself or the value at {@code result_path}. A response without a list yields
 * no items; non-object entries are dropped.
 */
@Service
public class IterationResolver {

    private static final Logger log = LoggerFactory.getLogger(IterationResolver.class);

    private final RestClient restClient;

    public IterationResolver(@Qualifier("serviceInvocationRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Call the iteration tool and return its items.
     *
     * @throws IterationResolutionException if the tool call fails
     */
    public List<Map<String, Object>> resolveItems(IterationSettings iteration) {
        Object response;
        try {
            response = restClient.post()
                    .uri("/invoke/{app}/method/tools/{tool}", iteration.sourceMcp(), iteration.sourceTool())
                    .body(iteration.toolArguments())
                    .retrieve()
                    .body(Object.class);
        } catch (RestClientException e) {
            throw new IterationResolutionException("Tool " + iteration.sourceMcp() + "/"
                    + iteration.sourceTool() + " failed", e);
        }

        Object list = response;
        if (iteration.resultPath() != null && !iteration.resultPath().isBlank()
                && response instanceof Map<?, ?> map) {
            list = DottedPath.resolve(asStringKeyed(map), iteration.resultPath());
        }
        if (!(list instanceof List<?> entries)) {
            log.warn("Tool {}/{} returned no list at '{}', nothing to iterate",
                    iteration.sourceMcp(), iteration.sourceTool(), iteration.resultPath());
            return List.of();
        }

        List<Map<String, Object>> items = new ArrayList<>();
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> item) {
                items.add(asStringKeyed(item));
            }
        }
        log.debug("Resolved {} {} items", items.size(),
                iteration.foreach() == null ? "iteration" : iteration.foreach());
        return items;
    }

    /**
     * Copy the linkage fields of an item. Dotted names are looked up through nested maps and kept
     * under their full name; missing fields are left out.
     */
    public static Map<String, Object> extractLinkage(Map<String, ?> item, List<String> linkageFields) {
        Map<String, Object> linkage = new LinkedHashMap<>();
        for (String field : linkageFields) {
            Object value = DottedPath.resolve(item, field);
            if (value != null) {
                linkage.put(field, value);
            }
        }
        return linkage;
    }

    private static Map<String, Object> asStringKeyed(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }
}
