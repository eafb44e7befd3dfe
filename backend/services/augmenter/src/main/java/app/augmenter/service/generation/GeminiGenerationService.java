package app.augmenter.service.generation;

import app.augmenter.client.gemini.GeminiClient;
import app.augmenter.client.gemini.GeminiProps;
import app.augmenter.client.gemini.GeminiResponseRequest;
import app.augmenter.client.gemini.GeminiResponseResult;
import app.augmenter.service.AugmentError;
import app.augmenter.service.AugmentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class GeminiGenerationService implements GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GeminiGenerationService.class);

    private final GeminiClient geminiClient;
    private final GeminiProps props;

    public GeminiGenerationService(GeminiClient geminiClient, GeminiProps props) {
        this.geminiClient = geminiClient;
        this.props = props;
    }

    @Override
    public void ensureReady() {
        if (!props.hasApiKey()) {
            throw new AugmentException(AugmentError.MISSING_CREDENTIALS, "GEMINI_API_KEY environment variable not set");
        }
    }

    @Override
    public String generate(String prompt) throws GenerationException {
        ensureReady();
        GeminiResponseResult result;
        try {
            result = geminiClient.createResponse(
                    props.apiKey(),
                    new GeminiResponseRequest(props.defaultModel(), prompt, props.maxOutputTokens())
            );
        } catch (RestClientResponseException ex) {
            throw new GenerationException("Gemini returned " + ex.getStatusCode().value(), ex);
        } catch (RestClientException | IllegalStateException ex) {
            throw new GenerationException("Gemini call failed: " + ex.getMessage(), ex);
        }
        String text = result.outputText() == null ? "" : result.outputText().strip();
        if (text.isEmpty()) {
            throw new GenerationException("Gemini returned no text, finishReason=" + result.finishReason());
        }
        log.debug("Gemini response model={} tokensIn={} tokensOut={}", result.model(), result.inputTokens(), result.outputTokens());
        return text;
    }
}
