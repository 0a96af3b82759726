package com.adobe.numeral.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for the numeral API.
 * 
 * <p>These tests verify the complete request/response cycle including:</p>
 * <ul>
 *   <li>JSON response format for success cases</li>
 *   <li>Plain text response format for error cases</li>
 *   <li>HTTP status codes per error type</li>
 *   <li>Correlation ID header</li>
 * </ul>
 */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Numeral API Integration Tests")
class NumeralIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Nested
    @DisplayName("Roman Encoding Endpoint")
    class RomanEncodingTests {

        @Test
        @DisplayName("GET /roman?query=42&ascii=true returns XLII")
        void shouldConvert42() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("query", "42")
                    .param("ascii", "true"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.input").value("42"))
                .andExpect(jsonPath("$.output").value("XLII"));
        }

        @Test
        @DisplayName("Zero and negative numbers use the extended defaults")
        void shouldConvertZeroAndNegative() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("query", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("N"));

            mockMvc.perform(get("/roman")
                    .param("query", "-42")
                    .param("ascii", "true")
                    .param("sign", "~"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("~XLII"));
        }

        @Test
        @DisplayName("Large numbers use Claudian notation")
        void shouldConvertLargeNumber() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("query", "16384")
                    .param("ascii", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("CCDODOMCCCLXXXIV"));
        }

        @Test
        @DisplayName("Additive flag spells 4 as IIII")
        void shouldConvertAdditive() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("query", "4")
                    .param("ascii", "true")
                    .param("additive", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("IIII"));
        }

        @Test
        @DisplayName("Lowercase flag")
        void shouldConvertLowercase() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("query", "1666")
                    .param("ascii", "true")
                    .param("uppercase", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("mdclxvi"));
        }
    }

    @Nested
    @DisplayName("Roman Range Endpoint")
    class RomanRangeTests {

        @Test
        @DisplayName("GET /roman?min=1&max=3 returns conversions array")
        void shouldConvertRange() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("min", "1")
                    .param("max", "3")
                    .param("ascii", "true"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.conversions", hasSize(3)))
                .andExpect(jsonPath("$.conversions[0].input").value("1"))
                .andExpect(jsonPath("$.conversions[0].output").value("I"))
                .andExpect(jsonPath("$.conversions[2].input").value("3"))
                .andExpect(jsonPath("$.conversions[2].output").value("III"));
        }

        @Test
        @DisplayName("Range through zero")
        void shouldConvertRangeThroughZero() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("min", "-1")
                    .param("max", "1")
                    .param("ascii", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversions[0].output").value("-I"))
                .andExpect(jsonPath("$.conversions[1].output").value("N"))
                .andExpect(jsonPath("$.conversions[2].output").value("I"));
        }

        @Test
        @DisplayName("Maximum allowed range (1000 items) succeeds")
        void shouldProcessMaxAllowedRange() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("min", "1")
                    .param("max", "1000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversions", hasSize(1000)));
        }

        @Test
        @DisplayName("Range exceeding max size returns 400")
        void shouldRejectOversizedRange() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("min", "1")
                    .param("max", "1002"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string(containsString("exceeds maximum")));
        }

        @Test
        @DisplayName("min >= max returns 400")
        void shouldRejectReversedRange() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("min", "10")
                    .param("max", "5"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("must be less than")));
        }

        @Test
        @DisplayName("Only min provided returns 400")
        void shouldRejectOnlyMin() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("min", "1"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Both")));
        }
    }

    @Nested
    @DisplayName("Roman Decoding Endpoint")
    class RomanDecodingTests {

        @Test
        @DisplayName("GET /roman/decode?text=MDCLXVI returns 1666")
        void shouldDecode() throws Exception {
            mockMvc.perform(get("/roman/decode")
                    .param("text", "MDCLXVI"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.input").value("MDCLXVI"))
                .andExpect(jsonPath("$.output").value("1666"));
        }

        @Test
        @DisplayName("Lenient mode accepts IIII")
        void shouldDecodeLenient() throws Exception {
            mockMvc.perform(get("/roman/decode")
                    .param("text", "iiii"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("4"));
        }

        @Test
        @DisplayName("Strict mode rejects IIII with 400")
        void shouldRejectStrict() throws Exception {
            mockMvc.perform(get("/roman/decode")
                    .param("text", "IIII")
                    .param("strict", "true"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string(startsWith("Error:")));
        }

        @Test
        @DisplayName("Large-number notation returns 422")
        void shouldRejectLargeNotation() throws Exception {
            mockMvc.perform(get("/roman/decode")
                    .param("text", "CCDO"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(content().string(containsString("not supported")));
        }

        @Test
        @DisplayName("Invalid characters return 400")
        void shouldRejectInvalidCharacters() throws Exception {
            mockMvc.perform(get("/roman/decode")
                    .param("text", "ABC"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Invalid character")));
        }
    }

    @Nested
    @DisplayName("Letters and Tokens Endpoints")
    class LettersAndTokensTests {

        @Test
        @DisplayName("GET /letters?query=702 returns aaa")
        void shouldEncodeLetters() throws Exception {
            mockMvc.perform(get("/letters")
                    .param("query", "702"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("aaa"));
        }

        @Test
        @DisplayName("GET /letters/decode?text=bxh returns 1983")
        void shouldDecodeLetters() throws Exception {
            mockMvc.perform(get("/letters/decode")
                    .param("text", "bxh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("1983"));
        }

        @Test
        @DisplayName("Custom alphabet")
        void shouldUseCustomAlphabet() throws Exception {
            mockMvc.perform(get("/letters")
                    .param("query", "9")
                    .param("alphabet", "AB"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("ABB"));
        }

        @Test
        @DisplayName("GET /tokens?query=9&tokens=po,ta returns potata")
        void shouldEncodeTokens() throws Exception {
            mockMvc.perform(get("/tokens")
                    .param("query", "9")
                    .param("tokens", "po,ta"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("potata"));
        }

        @Test
        @DisplayName("GET /tokens/decode round trips")
        void shouldDecodeTokens() throws Exception {
            mockMvc.perform(get("/tokens/decode")
                    .param("text", "-potata")
                    .param("tokens", "po", "ta"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("-9"));
        }

        @Test
        @DisplayName("Duplicate tokens return 400")
        void shouldRejectDuplicateTokens() throws Exception {
            mockMvc.perform(get("/tokens")
                    .param("query", "9")
                    .param("tokens", "po,po"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN));
        }
    }

    @Nested
    @DisplayName("Request Handling")
    class RequestHandlingTests {

        @Test
        @DisplayName("Invalid integer returns 400 with plain text")
        void shouldRejectInvalidInteger() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("query", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string(containsString("Invalid value")));
        }

        @Test
        @DisplayName("Missing all parameters returns 400")
        void shouldRejectNoParameters() throws Exception {
            mockMvc.perform(get("/roman"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Missing required parameter")));
        }

        @Test
        @DisplayName("Missing text returns 400")
        void shouldRejectMissingText() throws Exception {
            mockMvc.perform(get("/letters/decode"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("'text'")));
        }

        @Test
        @DisplayName("Option combination that cannot express the number returns 400")
        void shouldRejectUnexpressibleNumber() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("query", "4000")
                    .param("extended", "false"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("extended")));
        }

        @Test
        @DisplayName("Unknown path returns 404")
        void shouldReturn404() throws Exception {
            mockMvc.perform(get("/roman/nonexistent"))
                .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Correlation ID is echoed")
        void shouldEchoCorrelationId() throws Exception {
            mockMvc.perform(get("/roman")
                    .param("query", "1")
                    .header("X-Correlation-ID", "it-42"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-ID", "it-42"));
        }
    }
}
