package mailqueue.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured classification of an inbound message.
 *
 * @param category one of the CRM categories, e.g. {@code viewing_request}
 * @param sentiment {@code positive}, {@code neutral} or {@code negative}
 * @param priority {@code high}, {@code medium} or {@code low}
 * @param extractedEntities entity kind (phoneNumbers, addresses, dates, prices, propertyReferences)
 *     to the values found
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmailAnalysis(
    String category,
    String sentiment,
    String priority,
    String summary,
    Map<String, List<String>> extractedEntities,
    List<SuggestedAction> suggestedActions) {

  public EmailAnalysis {
    Map<String, List<String>> entities = new LinkedHashMap<>();
    if (extractedEntities != null) {
      extractedEntities.forEach((kind, values) -> {
        if (kind != null && values != null) {
          entities.put(kind, List.copyOf(values));
        }
      });
    }
    extractedEntities = Collections.unmodifiableMap(entities);
    suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
  }
}
