package dev.providers.backend;

import dev.providers.engine.ProviderValidator;
import dev.providers.engine.RateLimitWindow;
import dev.providers.model.Backend;
import dev.providers.model.ProviderDescriptor;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;

/**
 * Validates descriptors and binds each to exactly one backend.
 */
public final class ProviderFactory {

    private final HttpClient http;
    private final Function<String, String> env;
    private final Clock clock;
    private final LocalProcessExecutor.ProcessStarter processStarter;

    public ProviderFactory() {
        this(defaultHttpClient(), System::getenv, Clock.systemUTC(), ProcessBuilder::start);
    }

    public ProviderFactory(HttpClient http, Function<String, String> env, Clock clock,
                           LocalProcessExecutor.ProcessStarter processStarter) {
        this.http = http;
        this.env = env;
        this.clock = clock;
        this.processStarter = processStarter;
    }

    public static HttpClient defaultHttpClient() {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    /**
     * Validate {@code descriptor} and bind it to its backend.
     *
     * @throws dev.providers.error.ConfigValidationException if the descriptor is malformed
     */
    public Provider create(ProviderDescriptor descriptor) {
        ProviderValidator.requireValid(descriptor);
        return new Provider(descriptor, bind(descriptor), new RateLimitWindow(descriptor.rateLimits(), clock));
    }

    private ProviderBackend bind(ProviderDescriptor descriptor) {
        Backend backend = descriptor.backend();
        if (backend instanceof Backend.Local local) {
            return new LocalProcessExecutor(descriptor, local, processStarter);
        }
        if (backend instanceof Backend.RemoteApi api) {
            return new RemoteApiExecutor(descriptor, api, http, env);
        }
        if (backend instanceof Backend.Devserver devserver) {
            return new DevserverDispatcher(descriptor, devserver, http, env);
        }
        throw new IllegalStateException("Unhandled backend: " + backend);
    }
}
