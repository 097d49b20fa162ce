package com.phillippitts.livesubs.service.translate.llama;

import com.phillippitts.livesubs.config.properties.ContextProperties;
import com.phillippitts.livesubs.config.properties.TranslationProperties;
import com.phillippitts.livesubs.domain.ContextEntry;
import com.phillippitts.livesubs.domain.ContextSnapshot;
import com.phillippitts.livesubs.exception.ModelLoadException;
import com.phillippitts.livesubs.exception.TranslationException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlamaServerTranslationEngineTest {

    private static final MediaType JSON = MediaType.get("application/json");

    private final TranslationProperties props =
            new TranslationProperties("http://llama.test:8080/", "Japanese", "Chinese", 64, 0.2, 1000L);
    private final List<Request> requests = new CopyOnWriteArrayList<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();

    @Test
    void shouldCheckHealthEndpointOnLoad() {
        LlamaServerTranslationEngine engine = engine(200, "{\"status\":\"ok\"}");

        engine.loadModel();

        assertThat(engine.isReady()).isTrue();
        assertThat(requests).singleElement().satisfies(r -> {
            assertThat(r.method()).isEqualTo("GET");
            assertThat(r.url().toString()).isEqualTo("http://llama.test:8080/health");
        });
    }

    @Test
    void serverStillLoadingFailsLoad() {
        LlamaServerTranslationEngine engine = engine(503, "{\"error\":\"Loading model\"}");

        assertThatThrownBy(engine::loadModel)
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("HTTP 503");
        assertThat(engine.isReady()).isFalse();
    }

    @Test
    void unreachableServerFailsLoad() {
        LlamaServerTranslationEngine engine = new LlamaServerTranslationEngine(props, ContextProperties.defaults(),
                new OkHttpClient.Builder().addInterceptor(chain -> {
                    throw new IOException("Connection refused");
                }).build());

        assertThatThrownBy(engine::loadModel)
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("unreachable")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void postsCompletionRequestAndReturnsStrippedContent() {
        LlamaServerTranslationEngine engine = engine(200, "{\"content\":\" 你好 \",\"stop\":true}");
        engine.loadModel();
        ContextSnapshot ctx = new ContextSnapshot("", List.of(new ContextEntry("おはよう", "早安", 1)));

        String translated = engine.translate("こんにちは", ctx);

        assertThat(translated).isEqualTo("你好");
        Request completion = requests.get(1);
        assertThat(completion.method()).isEqualTo("POST");
        assertThat(completion.url().encodedPath()).isEqualTo("/completion");
        JSONObject body = new JSONObject(bodies.get(1));
        assertThat(body.getInt("n_predict")).isEqualTo(64);
        assertThat(body.getDouble("temperature")).isEqualTo(0.2);
        assertThat(body.getJSONArray("stop").getString(0)).isEqualTo("\n");
        assertThat(body.getString("prompt"))
                .startsWith("Recent:\n- おはよう\n\n")
                .contains("Japanese text into Chinese")
                .endsWith("こんにちは\nTranslation:");
    }

    @Test
    void errorStatusIsTranslationException() {
        LlamaServerTranslationEngine engine = withResponses(200, "{}", 500, "{\"error\":\"slot unavailable\"}");
        engine.loadModel();

        assertThatThrownBy(() -> engine.translate("はい", ContextSnapshot.EMPTY))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("HTTP 500")
                .hasMessageContaining("slot unavailable");
    }

    @Test
    void missingContentYieldsEmptyTranslation() {
        LlamaServerTranslationEngine engine = engine(200, "{}");
        engine.loadModel();

        assertThat(engine.translate("はい", ContextSnapshot.EMPTY)).isEmpty();
    }

    @Test
    void malformedResponseIsTranslationException() {
        LlamaServerTranslationEngine engine = withResponses(200, "{}", 200, "<html>proxy error</html>");
        engine.loadModel();

        assertThatThrownBy(() -> engine.translate("はい", ContextSnapshot.EMPTY))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("Malformed completion response");
    }

    @Test
    void translateBeforeLoadFails() {
        LlamaServerTranslationEngine engine = engine(200, "{}");

        assertThatThrownBy(() -> engine.translate("はい", ContextSnapshot.EMPTY))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("engine not loaded");
        assertThat(requests).isEmpty();
    }

    private LlamaServerTranslationEngine engine(int code, String body) {
        return withResponses(code, body, code, body);
    }

    /** First response answers the health check, the second every later call. */
    private LlamaServerTranslationEngine withResponses(int healthCode, String healthBody, int code, String body) {
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    Request request = chain.request();
                    requests.add(request);
                    String sent = "";
                    if (request.body() != null) {
                        Buffer buffer = new Buffer();
                        request.body().writeTo(buffer);
                        sent = buffer.readUtf8();
                    }
                    bodies.add(sent);
                    boolean health = request.url().encodedPath().equals("/health");
                    return new Response.Builder()
                            .request(request)
                            .protocol(Protocol.HTTP_1_1)
                            .code(health ? healthCode : code)
                            .message("scripted")
                            .body(ResponseBody.create(health ? healthBody : body, JSON))
                            .build();
                })
                .build();
        return new LlamaServerTranslationEngine(props, ContextProperties.defaults(), client);
    }
}
