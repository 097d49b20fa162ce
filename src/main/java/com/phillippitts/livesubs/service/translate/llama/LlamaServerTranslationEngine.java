package com.phillippitts.livesubs.service.translate.llama;

import com.phillippitts.livesubs.config.properties.ContextProperties;
import com.phillippitts.livesubs.config.properties.TranslationProperties;
import com.phillippitts.livesubs.domain.ContextSnapshot;
import com.phillippitts.livesubs.exception.ModelLoadException;
import com.phillippitts.livesubs.exception.TranslationException;
import com.phillippitts.livesubs.service.engine.AbstractModelEngine;
import com.phillippitts.livesubs.service.translate.TranslationEngine;
import com.phillippitts.livesubs.service.translate.TranslationPromptBuilder;
import com.phillippitts.livesubs.util.LogSanitizer;
import com.phillippitts.livesubs.util.TimeUtils;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Translation engine backed by a llama.cpp HTTP server.
 *
 * <p>Loading checks {@code GET /health}; each translation is a {@code POST /completion} with the
 * prompt from {@link TranslationPromptBuilder}. Generation stops at the first newline so the
 * model returns a single subtitle line.
 */
@Component
public class LlamaServerTranslationEngine extends AbstractModelEngine implements TranslationEngine {

    private static final Logger LOG = LogManager.getLogger(LlamaServerTranslationEngine.class);

    static final String ENGINE = "llama-server";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String WARM_UP_TEXT = "テスト";

    private final TranslationProperties props;
    private final TranslationPromptBuilder promptBuilder;
    private final OkHttpClient httpClient;
    private final String baseUrl;

    @Autowired
    public LlamaServerTranslationEngine(TranslationProperties props, ContextProperties contextProperties) {
        this(props, contextProperties, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .callTimeout(Duration.ofMillis(props.timeoutMillis()))
                .build());
    }

    // Package-private for tests
    LlamaServerTranslationEngine(TranslationProperties props, ContextProperties contextProperties,
                                 OkHttpClient httpClient) {
        this.props = Objects.requireNonNull(props, "props");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.promptBuilder = new TranslationPromptBuilder(props.sourceLanguage(), props.targetLanguage(),
                contextProperties.getPromptRecentTurns());
        this.baseUrl = props.serverUrl().endsWith("/")
                ? props.serverUrl().substring(0, props.serverUrl().length() - 1)
                : props.serverUrl();
    }

    @Override
    protected void doLoadModel() {
        Request request = new Request.Builder().url(baseUrl + "/health").get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new ModelLoadException(ENGINE, "llama server not ready: HTTP " + response.code()
                        + " from " + baseUrl);
            }
        } catch (IOException e) {
            throw new ModelLoadException(ENGINE, "llama server unreachable at " + baseUrl, e);
        }
        LOG.info("Translation engine ready: url={}, {} -> {}, maxTokens={}, temperature={}",
                baseUrl, props.sourceLanguage(), props.targetLanguage(), props.maxTokens(), props.temperature());
    }

    @Override
    public void warmUp() {
        long start = System.nanoTime();
        translate(WARM_UP_TEXT, ContextSnapshot.EMPTY);
        LOG.info("Translation warm-up finished in {} ms", TimeUtils.elapsedMillis(start));
    }

    @Override
    public String translate(String text, ContextSnapshot context) {
        Objects.requireNonNull(text, "text");
        if (!isReady()) {
            throw new TranslationException("engine not loaded", ENGINE);
        }
        String prompt = promptBuilder.build(text, context);
        JSONObject body = new JSONObject()
                .put("prompt", prompt)
                .put("n_predict", props.maxTokens())
                .put("temperature", props.temperature())
                .put("stop", new JSONArray().put("\n"))
                .put("cache_prompt", true);
        Request request = new Request.Builder()
                .url(baseUrl + "/completion")
                .post(RequestBody.create(body.toString(), JSON))
                .build();

        long start = System.nanoTime();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String payload = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw new TranslationException("HTTP " + response.code() + ": "
                        + LogSanitizer.truncate(payload, 200), ENGINE);
            }
            String translation = new JSONObject(payload).optString("content", "").strip();
            LOG.debug("Translated {} chars in {} ms", text.length(), TimeUtils.elapsedMillis(start));
            return translation;
        } catch (IOException e) {
            throw new TranslationException("Request failed: " + e.getMessage(), ENGINE, e);
        } catch (JSONException e) {
            throw new TranslationException("Malformed completion response: " + e.getMessage(), ENGINE, e);
        }
    }

    @Override
    public String getEngineName() {
        return ENGINE;
    }

    @Override
    protected void doClose() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
        LOG.info("Translation engine closed");
    }
}
