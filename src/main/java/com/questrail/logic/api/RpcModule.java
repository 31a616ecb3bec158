package com.questrail.logic.api;

import com.questrail.logic.registry.ApiMeta;
import com.questrail.logic.registry.DuplicateMethodException;
import com.questrail.logic.schema.RpcParameters;
import com.questrail.logic.schema.RpcResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * RpcModule
 * =============================================================================
 * A named bundle of API handlers and lifecycle hooks.
 *
 * <h2>Registration</h2>
 * Modules are assembled with the fluent methods below during bootstrap and then
 * handed to {@link com.questrail.logic.registry.ModuleRegistry}:
 *
 * <pre>{@code
 * RpcModule module = new RpcModule("test_module", "Test", "Doubles numbers")
 *         .api("test_function", TestParameters.class, TestResponse.class,
 *              p -> new TestResponse(p.value() * 2))
 *         .onStart(() -> log.info("ready"));
 * }</pre>
 *
 * <p>Parameter and response types are described once, here, and rejected with
 * {@link com.questrail.logic.schema.SchemaDefinitionException} if they cannot
 * be carried on the wire.</p>
 *
 * <h2>Freezing</h2>
 * The registry freezes every module when it is sealed at server start. After
 * that, adding APIs or hooks fails with {@link IllegalStateException}. The
 * context map remains writable so hooks and handlers can share state.
 *
 * <h2>Context</h2>
 * {@link #setContext(Class, Object)} and {@link #getContext(Class)} provide a
 * type-keyed slot map that a module's hooks and handlers use to pass
 * dependencies to each other, e.g. a start hook opening a client that handlers
 * later read.
 */
public final class RpcModule
{
    private final String id;
    private final String name;
    private final String description;

    private final Map<String, ApiMeta<?, ?>> apis = new LinkedHashMap<>();
    private final List<LifecycleHook> startHooks = new ArrayList<>();
    private final List<LifecycleHook> shutdownHooks = new ArrayList<>();
    private final Map<Class<?>, Object> context = new ConcurrentHashMap<>();

    private volatile boolean frozen;

    public RpcModule(String id, String name, String description)
    {
        this.id = requireText(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.description = Objects.requireNonNull(description, "description");
    }

    public RpcModule(String id)
    {
        this(id, id, "");
    }

    public String id()
    {
        return id;
    }

    public String name()
    {
        return name;
    }

    public String description()
    {
        return description;
    }

    // -------------------------------------------------------------------------
    // APIs
    // -------------------------------------------------------------------------

    /**
     * Register a blocking handler under {@code methodName}.
     *
     * @throws DuplicateMethodException if the name is already taken in this module
     */
    public <P extends RpcParameters, R extends RpcResponse> RpcModule api(String methodName,
                                                                          Class<P> parameterType,
                                                                          Class<R> responseType,
                                                                          ApiHandler<P, R> handler)
    {
        register(ApiMeta.blocking(methodName, parameterType, responseType, handler));
        return this;
    }

    /**
     * Register a non-blocking handler under {@code methodName}.
     *
     * @throws DuplicateMethodException if the name is already taken in this module
     */
    public <P extends RpcParameters, R extends RpcResponse> RpcModule asyncApi(String methodName,
                                                                               Class<P> parameterType,
                                                                               Class<R> responseType,
                                                                               AsyncApiHandler<P, R> handler)
    {
        register(ApiMeta.async(methodName, parameterType, responseType, handler));
        return this;
    }

    /**
     * Add prepared API metadata to this module.
     *
     * @throws DuplicateMethodException if the method name is already present
     * @throws IllegalStateException if the module is frozen
     */
    public void register(ApiMeta<?, ?> meta)
    {
        Objects.requireNonNull(meta, "meta");
        requireMutable();

        if (apis.containsKey(meta.methodName())) {
            throw new DuplicateMethodException(id, meta.methodName());
        }
        apis.put(meta.methodName(), meta);
    }

    public Optional<ApiMeta<?, ?>> findApi(String methodName)
    {
        return Optional.ofNullable(apis.get(methodName));
    }

    /**
     * @return APIs in registration order
     */
    public Map<String, ApiMeta<?, ?>> apis()
    {
        return Collections.unmodifiableMap(apis);
    }

    // -------------------------------------------------------------------------
    // Lifecycle hooks
    // -------------------------------------------------------------------------

    public RpcModule onStart(LifecycleHook hook)
    {
        addStartHook(hook);
        return this;
    }

    public RpcModule onStartAsync(AsyncLifecycleHook hook)
    {
        addStartHook(awaiting(hook));
        return this;
    }

    public RpcModule onShutdown(LifecycleHook hook)
    {
        addShutdownHook(hook);
        return this;
    }

    public RpcModule onShutdownAsync(AsyncLifecycleHook hook)
    {
        addShutdownHook(awaiting(hook));
        return this;
    }

    public void addStartHook(LifecycleHook hook)
    {
        Objects.requireNonNull(hook, "hook");
        requireMutable();
        startHooks.add(hook);
    }

    public void addShutdownHook(LifecycleHook hook)
    {
        Objects.requireNonNull(hook, "hook");
        requireMutable();
        shutdownHooks.add(hook);
    }

    public List<LifecycleHook> startHooks()
    {
        return Collections.unmodifiableList(startHooks);
    }

    public List<LifecycleHook> shutdownHooks()
    {
        return Collections.unmodifiableList(shutdownHooks);
    }

    // -------------------------------------------------------------------------
    // Context
    // -------------------------------------------------------------------------

    public <T> void setContext(Class<T> key, T value)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        context.put(key, key.cast(value));
    }

    public <T> Optional<T> getContext(Class<T> key)
    {
        Objects.requireNonNull(key, "key");
        return Optional.ofNullable(key.cast(context.get(key)));
    }

    public <T> Optional<T> removeContext(Class<T> key)
    {
        Objects.requireNonNull(key, "key");
        return Optional.ofNullable(key.cast(context.remove(key)));
    }

    // -------------------------------------------------------------------------
    // Freezing
    // -------------------------------------------------------------------------

    /**
     * Reject further API and hook registration. Idempotent.
     */
    public void freeze()
    {
        frozen = true;
    }

    public boolean isFrozen()
    {
        return frozen;
    }

    @Override
    public String toString()
    {
        return "RpcModule[" + id + ", apis=" + apis.keySet() + "]";
    }

    private void requireMutable()
    {
        if (frozen) {
            throw new IllegalStateException("module '" + id + "' is frozen; register before the server starts");
        }
    }

    private static LifecycleHook awaiting(AsyncLifecycleHook hook)
    {
        Objects.requireNonNull(hook, "hook");
        return () -> {
            try {
                hook.run().toCompletableFuture().get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception ex) {
                    throw ex;
                }
                if (cause instanceof Error err) {
                    throw err;
                }
                throw e;
            }
        };
    }

    private static String requireText(String value, String field)
    {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
