package mailqueue.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SuggestedAction(String action, double confidence, String details) {
}
