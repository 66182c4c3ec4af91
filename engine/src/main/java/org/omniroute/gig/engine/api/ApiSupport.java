package org.omniroute.gig.engine.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.omniroute.gig.engine.spi.CollaboratorException;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Shared Retrofit plumbing for the collaborator clients.
 */
final class ApiSupport {

    static final int NOT_FOUND = 404;
    static final int CONFLICT = 409;

    private ApiSupport() {
    }

    static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    static OkHttpClient httpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .build();
    }

    static <S> S create(String baseUrl, OkHttpClient client, Class<S> service) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(objectMapper()))
                .client(client)
                .build();
        return retrofit.create(service);
    }

    /**
     * Execute a call and return the raw response, failing only on transport errors.
     */
    static <T> Response<T> send(Call<T> call, String description) {
        try {
            return call.execute();
        } catch (IOException e) {
            throw new CollaboratorException("[API] " + description + " error: " + e.getMessage(), e);
        }
    }

    /**
     * Execute a call and return the body of a successful response.
     */
    static <T> T execute(Call<T> call, String description) {
        Response<T> response = send(call, description);
        if (!response.isSuccessful()) {
            throw failure(response, description);
        }
        return response.body();
    }

    static CollaboratorException failure(Response<?> response, String description) {
        return new CollaboratorException(String.format("[API] %s failed: %d %s",
                description, response.code(), response.message()));
    }
}
