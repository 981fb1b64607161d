package com.example.collab.session.frame;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundFrame {
    private MessageType type;
    private JsonNode data;
    private Long timestamp;

    /**
     * Text field of the payload, or null when the payload is missing or the field is not textual.
     */
    public String dataText(String field) {
        if (data == null || !data.hasNonNull(field) || !data.get(field).isTextual()) {
            return null;
        }
        return data.get(field).asText();
    }
}
