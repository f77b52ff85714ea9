package com.factmarrow.orchestrator;

import com.factmarrow.exception.ExecutionFailedException;
import com.factmarrow.model.DocumentMetadata;
import com.factmarrow.model.ExtractedClaim;
import com.factmarrow.model.QualityAssessment;
import com.factmarrow.model.VerificationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentResultDecoderTest {

    private final AgentResultDecoder decoder = new AgentResultDecoder();

    private static final ExtractedClaim CLAIM = new ExtractedClaim(
            "C-001", "Smoking causes lung cancer", "causal", null, 0.9, null);

    @Test
    void shouldDecodeMetadataInsideCodeFence() {
        DocumentMetadata metadata = decoder.decodeMetadata("document_processor", """
                ```json
                {
                  "metadata": {
                    "title": "Annual Health Report",
                    "authors": ["Dr. Ada"],
                    "publication_date": "2023-05-01",
                    "abstract": "Summary",
                  },
                  "structure": []
                }
                ```
                """);

        assertThat(metadata.title()).isEqualTo("Annual Health Report");
        assertThat(metadata.authors()).containsExactly("Dr. Ada");
        assertThat(metadata.publicationDate()).isEqualTo("2023-05-01");
        assertThat(metadata.abstractText()).isEqualTo("Summary");
        assertThat(metadata.institution()).isNull();
        assertThat(metadata.keywords()).isEmpty();
    }

    @Test
    void shouldReadMetadataFromRootWhenNotNested() {
        DocumentMetadata metadata = decoder.decodeMetadata("document_processor",
                "{\"title\": \"Flat\", \"keywords\": \"vaccines\"}");

        assertThat(metadata.title()).isEqualTo("Flat");
        assertThat(metadata.keywords()).containsExactly("vaccines");
    }

    @Test
    void shouldNumberClaimsAndApplyDefaults() {
        List<ExtractedClaim> claims = decoder.decodeClaims("fact_extractor", """
                {"claims": [
                  {"text": "Obesity rates doubled since 1990", "type": "quantitative", "confidence": 0.8,
                   "location": "Section 2", "supporting_text": "Table 3"},
                  {"text": "   "},
                  {"claim": "Exercise reduces mortality"}
                ]}
                """);

        assertThat(claims).hasSize(2);
        assertThat(claims.get(0).id()).isEqualTo("C-001");
        assertThat(claims.get(0).location()).isEqualTo("Section 2");
        assertThat(claims.get(0).supportingText()).isEqualTo("Table 3");
        assertThat(claims.get(1).id()).isEqualTo("C-002");
        assertThat(claims.get(1).text()).isEqualTo("Exercise reduces mortality");
        assertThat(claims.get(1).type()).isEqualTo(ExtractedClaim.UNKNOWN_TYPE);
        assertThat(claims.get(1).confidence()).isEqualTo(ExtractedClaim.DEFAULT_CONFIDENCE);
    }

    @Test
    void shouldAcceptTopLevelClaimArray() {
        List<ExtractedClaim> claims = decoder.decodeClaims("fact_extractor",
                "[\"Claim one\", {\"text\": \"Claim two\", \"confidence\": 7}]");

        assertThat(claims).extracting(ExtractedClaim::text).containsExactly("Claim one", "Claim two");
        assertThat(claims.get(1).confidence()).isEqualTo(1.0);
    }

    @Test
    void shouldReturnNoClaimsWhenKeyIsAbsent() {
        assertThat(decoder.decodeClaims("fact_extractor", "{\"notes\": \"nothing found\"}")).isEmpty();
    }

    @Test
    void shouldRejectClaimsThatAreNotAList() {
        assertThatThrownBy(() -> decoder.decodeClaims("fact_extractor", "{\"claims\": \"many\"}"))
                .isInstanceOf(ExecutionFailedException.class)
                .hasMessageContaining("not a list");
    }

    @Test
    void shouldDecodeVerificationWithClaimIdentity() {
        VerificationResult result = decoder.decodeVerification("verification_specialist", CLAIM, """
                {"verification_status": "supported", "confidence": "92%",
                 "supporting_sources": [{"title": "Surgeon General 1964"}, "WHO"],
                 "notes": "Strong consensus"}
                """);

        assertThat(result.claimId()).isEqualTo("C-001");
        assertThat(result.claimText()).isEqualTo(CLAIM.text());
        assertThat(result.verificationStatus()).isEqualTo("supported");
        assertThat(result.confidence()).isEqualTo(92.0);
        assertThat(result.supportingSources()).containsExactly("Surgeon General 1964", "WHO");
        assertThat(result.contradictingSources()).isEmpty();
        assertThat(result.notes()).isEqualTo("Strong consensus");
    }

    @Test
    void shouldDefaultVerificationFields() {
        VerificationResult result = decoder.decodeVerification("verification_specialist", CLAIM, "{}");

        assertThat(result.verificationStatus()).isEqualTo(VerificationResult.DEFAULT_STATUS);
        assertThat(result.confidence()).isZero();
    }

    @Test
    void shouldDecodeQualityReview() {
        QualityAssessment qa = decoder.decodeQualityReview("quality_reviewer",
                "{feedback: 'Needs more citations', confidence: 70, approved_for_publication: false}");

        assertThat(qa.feedback()).isEqualTo("Needs more citations");
        assertThat(qa.confidence()).isEqualTo(70.0);
        assertThat(qa.approvedForPublication()).isFalse();
    }

    @Test
    void shouldLeaveQualityConfidenceUnsetWhenAbsent() {
        QualityAssessment qa = decoder.decodeQualityReview("quality_reviewer", "{\"approved\": \"yes\"}");

        assertThat(qa.confidence()).isNull();
        assertThat(qa.feedback()).isNull();
        assertThat(qa.approvedForPublication()).isTrue();
    }

    @Test
    void shouldFallBackWhenConfidenceIsNotFinite() {
        // Given
        String claimsOutput = "{\"claims\": [{\"text\": \"Claim one\", \"confidence\": \"NaN\"}]}";

        // When
        List<ExtractedClaim> claims = decoder.decodeClaims("fact_extractor", claimsOutput);
        VerificationResult notANumber = decoder.decodeVerification("verification_specialist", CLAIM,
                "{\"verification_status\": \"supported\", \"confidence\": \"NaN\"}");
        VerificationResult infinite = decoder.decodeVerification("verification_specialist", CLAIM,
                "{\"verification_status\": \"supported\", \"confidence\": \"Infinity\"}");
        QualityAssessment qa = decoder.decodeQualityReview("quality_reviewer",
                "{\"feedback\": \"ok\", \"confidence\": \"-Infinity\"}");

        // Then
        assertThat(claims.get(0).confidence()).isEqualTo(ExtractedClaim.DEFAULT_CONFIDENCE);
        assertThat(notANumber.confidence()).isZero();
        assertThat(infinite.confidence()).isZero();
        assertThat(qa.confidence()).isNull();
    }

    @Test
    void shouldClampQualityConfidence() {
        QualityAssessment high = decoder.decodeQualityReview("quality_reviewer",
                "{\"feedback\": \"Excellent\", \"confidence\": 250, \"approved_for_publication\": true}");
        QualityAssessment low = decoder.decodeQualityReview("quality_reviewer", "{\"confidence\": \"-5%\"}");

        assertThat(high.confidence()).isEqualTo(100.0);
        assertThat(low.confidence()).isZero();
    }

    @Test
    void shouldNormalizeConfidenceInRecordsBuiltDirectly() {
        assertThat(new ExtractedClaim("C-001", "Claim", "causal", null, Double.NaN, null).confidence())
                .isEqualTo(ExtractedClaim.DEFAULT_CONFIDENCE);
        assertThat(new VerificationResult("C-001", "Claim", "supported", Double.NaN, null, null, null).confidence())
                .isZero();
        assertThat(new QualityAssessment("ok", Double.NaN, false).confidence()).isNull();
        assertThat(new QualityAssessment("ok", 140.0, true).confidence()).isEqualTo(100.0);
    }

    @Test
    void shouldRejectNonJsonOutput() {
        assertThatThrownBy(() -> decoder.decodeQualityReview("quality_reviewer", "Looks fine to me!"))
                .isInstanceOf(ExecutionFailedException.class)
                .hasMessageStartingWith("Agent 'quality_reviewer' returned unparsable output");
    }

    @Test
    void shouldRejectArrayWhereObjectIsExpected() {
        assertThatThrownBy(() -> decoder.decodeVerification("verification_specialist", CLAIM, "[1, 2]"))
                .isInstanceOf(ExecutionFailedException.class)
                .hasMessageContaining("where a JSON object was expected");
    }

    @Test
    void shouldKeepReportTextTrimmed() {
        assertThat(decoder.decodeReport("report_writer", "\n# Report\n\nBody\n")).isEqualTo("# Report\n\nBody");
        assertThatThrownBy(() -> decoder.decodeReport("report_writer", "  "))
                .isInstanceOf(ExecutionFailedException.class);
    }

    @Test
    void shouldStripCodeFences() {
        assertThat(AgentResultDecoder.stripCodeFence("```\n{}\n```")).isEqualTo("{}");
        assertThat(AgentResultDecoder.stripCodeFence("{\"a\": 1}")).isEqualTo("{\"a\": 1}");
    }
}
