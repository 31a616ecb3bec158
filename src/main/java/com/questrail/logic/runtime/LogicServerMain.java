package com.questrail.logic.runtime;

import com.questrail.logic.config.RpcServerConfig;
import com.questrail.logic.observability.Slf4jRpcObservabilitySink;
import com.questrail.logic.registry.ModuleRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Properties;

/**
 * Process entry point.
 *
 * <p>Usage: {@code LogicServerMain [socket-path]}. Other settings come from
 * {@code logic.rpc.*} system properties; see {@link RpcServerConfig}.</p>
 */
public final class LogicServerMain
{
    private static final Logger log = LoggerFactory.getLogger(LogicServerMain.class);

    private LogicServerMain() {}

    public static void main(String[] args)
    {
        RpcServerConfig config = loadConfig(System.getProperties(), args);

        ModuleRegistry registry = new ModuleRegistry();
        new ModuleLoader().loadInto(registry);
        if (registry.modules().isEmpty()) {
            log.warn("No RPC modules found on the classpath");
        }

        LogicRpcServer server = LogicRpcServer.builder()
                .withConfig(config)
                .withRegistry(registry)
                .withObservabilitySink(new Slf4jRpcObservabilitySink())
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "logic-rpc-shutdown"));

        log.info("Starting RPC server on {}", config.socketPath());
        server.start();
        server.awaitTermination();
    }

    static RpcServerConfig loadConfig(Properties props, String[] args)
    {
        RpcServerConfig config = RpcServerConfig.fromProperties(props);
        if (args.length > 0 && !args[0].isBlank()) {
            config = new RpcServerConfig(
                    Path.of(args[0]),
                    config.restartBackoff(),
                    config.ioThreads(),
                    config.workerThreads(),
                    config.maxPayloadLength(),
                    config.drainTimeout(),
                    config.rerunStartHooksOnRestart());
        }
        return config;
    }
}
