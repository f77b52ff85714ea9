package com.factmarrow.orchestrator;

import com.factmarrow.exception.ExecutionFailedException;
import com.factmarrow.model.DocumentMetadata;
import com.factmarrow.model.ExtractedClaim;
import com.factmarrow.model.QualityAssessment;
import com.factmarrow.model.VerificationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the raw text returned by agents into phase results.
 * <p>
 * Parsing is lenient (trailing commas, comments, single quotes, unquoted names,
 * markdown code fences). Numbers that are not finite count as absent. Field defaults:
 * <ul>
 *   <li>metadata: scalars null, {@code authors}/{@code keywords} empty</li>
 *   <li>claims: {@code type} "unknown", {@code confidence} 0.5, entries without text dropped</li>
 *   <li>verification: {@code verification_status} "uncertain", {@code confidence} 0, sources empty</li>
 *   <li>quality review: {@code feedback} null, {@code confidence} null (also when unparsable), {@code approved_for_publication} false</li>
 * </ul>
 * Output that is not JSON where JSON is expected fails with {@link ExecutionFailedException}.
 */
public class AgentResultDecoder {

    private static final Logger log = LoggerFactory.getLogger(AgentResultDecoder.class);

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Reads {@code metadata} (or the top-level object when absent).
     */
    public DocumentMetadata decodeMetadata(String agentName, String raw) {
        JsonNode root = parseObject(agentName, raw);
        JsonNode metadata = root.has("metadata") && root.get("metadata").isObject()
                ? root.get("metadata")
                : root;
        return new DocumentMetadata(
                text(metadata, "title"),
                strings(metadata, "authors"),
                text(metadata, "publication_date", "publicationDate", "date"),
                text(metadata, "institution"),
                text(metadata, "abstract"),
                strings(metadata, "keywords")
        );
    }

    /**
     * Reads claims from {@code claims} or from a top-level array, numbering them
     * {@code C-001}, {@code C-002}, ... in order.
     */
    public List<ExtractedClaim> decodeClaims(String agentName, String raw) {
        JsonNode root = parse(agentName, raw);
        JsonNode claims = root.isArray() ? root : root.get("claims");
        if (claims == null || claims.isNull()) {
            return List.of();
        }
        if (!claims.isArray()) {
            throw new ExecutionFailedException(agentName,
                    "Agent '" + agentName + "' returned 'claims' that is not a list");
        }

        List<ExtractedClaim> decoded = new ArrayList<>();
        for (JsonNode claim : claims) {
            String text = claim.isTextual() ? claim.asText() : text(claim, "text", "claim");
            if (text == null || text.isBlank()) {
                log.warn("{}: dropping claim without text: {}", agentName, claim);
                continue;
            }
            decoded.add(new ExtractedClaim(
                    ExtractedClaim.idFor(decoded.size() + 1),
                    text.trim(),
                    text(claim, "type"),
                    text(claim, "location", "section"),
                    number(claim, ExtractedClaim.DEFAULT_CONFIDENCE, "confidence"),
                    text(claim, "supporting_text", "supportingText")
            ));
        }
        return decoded;
    }

    public VerificationResult decodeVerification(String agentName, ExtractedClaim claim, String raw) {
        JsonNode root = parseObject(agentName, raw);
        return new VerificationResult(
                claim.id(),
                claim.text(),
                text(root, "verification_status", "verificationStatus", "status"),
                number(root, 0.0, "confidence"),
                strings(root, "supporting_sources", "supportingSources"),
                strings(root, "contradicting_sources", "contradictingSources"),
                text(root, "notes")
        );
    }

    /** The report is stored as returned, trimmed. */
    public String decodeReport(String agentName, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ExecutionFailedException(agentName, "Agent '" + agentName + "' returned an empty report");
        }
        return raw.trim();
    }

    public QualityAssessment decodeQualityReview(String agentName, String raw) {
        JsonNode root = parseObject(agentName, raw);
        JsonNode confidence = field(root, "confidence");
        JsonNode approved = field(root, "approved_for_publication", "approvedForPublication", "approved");
        return new QualityAssessment(
                text(root, "feedback"),
                confidence != null && (confidence.isNumber() || confidence.isTextual())
                        ? number(root, Double.NaN, "confidence")
                        : null,
                approved != null && (approved.asBoolean(false) || "yes".equalsIgnoreCase(approved.asText()))
        );
    }

    // ── Parsing helpers ─────────────────────────────────────────────────────

    private static JsonNode parseObject(String agentName, String raw) {
        JsonNode node = parse(agentName, raw);
        if (!node.isObject()) {
            throw new ExecutionFailedException(agentName,
                    "Agent '" + agentName + "' returned " + node.getNodeType() + " where a JSON object was expected");
        }
        return node;
    }

    private static JsonNode parse(String agentName, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ExecutionFailedException(agentName, "Agent '" + agentName + "' returned an empty response");
        }
        try {
            JsonNode node = LENIENT_MAPPER.readTree(stripCodeFence(raw));
            if (node == null || node.isMissingNode()) {
                throw new ExecutionFailedException(agentName, "Agent '" + agentName + "' returned no JSON");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ExecutionFailedException(agentName,
                    "Agent '" + agentName + "' returned unparsable output: " + e.getOriginalMessage(), e);
        }
    }

    static String stripCodeFence(String raw) {
        String trimmed = raw.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).trim();
    }

    private static JsonNode field(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String... names) {
        JsonNode value = field(node, names);
        if (value == null || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static double number(JsonNode node, double fallback, String... names) {
        JsonNode value = field(node, names);
        if (value == null) {
            return fallback;
        }
        double parsed;
        if (value.isNumber()) {
            parsed = value.doubleValue();
        } else if (value.isTextual()) {
            try {
                parsed = Double.parseDouble(value.asText().trim().replace("%", ""));
            } catch (NumberFormatException e) {
                return fallback;
            }
        } else {
            return fallback;
        }
        // "NaN" and "Infinity" parse but are not scores
        return Double.isFinite(parsed) ? parsed : fallback;
    }

    private static List<String> strings(JsonNode node, String... names) {
        JsonNode value = field(node, names);
        if (value == null) {
            return List.of();
        }
        if (value.isValueNode()) {
            return value.asText().isBlank() ? List.of() : List.of(value.asText());
        }
        List<String> result = new ArrayList<>();
        for (JsonNode item : value) {
            String entry = item.isValueNode() ? item.asText() : text(item, "url", "id", "title", "name");
            if (entry == null) {
                entry = item.toString();
            }
            if (!entry.isBlank()) {
                result.add(entry);
            }
        }
        return result;
    }
}
