package dev.mlagents.gateway;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.OpenAIInvalidDataException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import dev.mlagents.config.MlAgentsConfig;
import dev.mlagents.log.MlAgentsLogger;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nonnull;

/**
 * {@link LLMGateway} over the OpenAI Java SDK. Works against any OpenAI-compatible endpoint; by
 * default OpenRouter. SDK-side retries are disabled since retrying is decided by the caller.
 */
public class OpenAiGateway implements LLMGateway {
    private final OpenAIClient client;

    public OpenAiGateway(@Nonnull OpenAIClient client) {
        this.client = client;
    }

    /** Creates a gateway for the configured OpenRouter (or compatible) endpoint. */
    public static OpenAiGateway of(MlAgentsConfig config) {
        var apiKey =
                config.openrouterApiKey()
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "OPENROUTER_API_KEY is required"));
        var client =
                OpenAIOkHttpClient.builder()
                        .baseUrl(config.openrouterBaseUrl())
                        .apiKey(apiKey)
                        .maxRetries(0)
                        .timeout(config.requestTimeout())
                        .putHeader("X-Title", config.appName())
                        .build();
        return new OpenAiGateway(client);
    }

    @Override
    public GatewayOutcome execute(GatewayRequest request, Duration timeout) {
        var params = toParams(request);
        MlAgentsLogger.debug("LLM request: model={} timeout={}", request.modelId(), timeout);
        var future = client.async().chat().completions().create(params);
        try {
            var completion = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return toOutcome(completion);
        } catch (TimeoutException e) {
            future.cancel(true);
            return GatewayOutcome.failure(RawError.timeout("no response after " + timeout));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return GatewayOutcome.failure(RawError.client("interrupted while waiting", e));
        } catch (ExecutionException e) {
            var error = toRawError(unwrap(e));
            MlAgentsLogger.debug("LLM request failed: model={} {}", request.modelId(), error);
            return GatewayOutcome.failure(error);
        }
    }

    static ChatCompletionCreateParams toParams(GatewayRequest request) {
        var builder =
                ChatCompletionCreateParams.builder()
                        .model(request.modelId())
                        .addSystemMessage(request.systemPrompt())
                        .addUserMessage(request.userPrompt());
        request.temperature().ifPresent(t -> builder.temperature(t.doubleValue()));
        request.maxTokens().ifPresent(m -> builder.maxCompletionTokens(m.longValue()));
        return builder.build();
    }

    private static GatewayOutcome toOutcome(ChatCompletion completion) {
        if (completion.choices().isEmpty()) {
            return GatewayOutcome.failure(
                    RawError.malformedBody("response contained no choices", null));
        }
        var content = completion.choices().get(0).message().content().orElse("");
        return GatewayOutcome.success(new RawResponse(content, completion.model()));
    }

    static RawError toRawError(Throwable error) {
        if (error instanceof OpenAIServiceException serviceException) {
            return RawError.httpStatus(
                    serviceException.statusCode(), serviceException.getMessage());
        }
        if (error instanceof OpenAIIoException) {
            if (hasCause(error, InterruptedIOException.class)) {
                return RawError.timeout(String.valueOf(error.getMessage()), error);
            }
            return RawError.connection(String.valueOf(error.getMessage()), error);
        }
        if (error instanceof OpenAIInvalidDataException) {
            return RawError.malformedBody(String.valueOf(error.getMessage()), error);
        }
        MlAgentsLogger.warn("Unexpected error from LLM client", error);
        return RawError.client(error.toString(), error);
    }

    private static Throwable unwrap(Throwable error) {
        var current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (var current = error; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
