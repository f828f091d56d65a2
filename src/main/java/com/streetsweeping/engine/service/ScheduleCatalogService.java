package com.streetsweeping.engine.service;

import com.streetsweeping.engine.config.SweepingProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the current {@link ScheduleCatalog}.
 *
 * Loading runs on the catalog loader executor. Until the first load completes (or when
 * it fails) readers get the empty catalog, which resolves every point to "no restriction".
 * A finished load replaces the catalog in one atomic swap, so a request always sees
 * either the old or the new catalog, never a mix.
 */
@Service
@Slf4j
public class ScheduleCatalogService {

    private final SweepingProperties properties;
    private final ResourceLoader resourceLoader;
    private final Executor loaderExecutor;
    private final Clock clock;
    private final GeometryParser geometryParser = new GeometryParser();

    private final AtomicReference<ScheduleCatalog> current;
    private final AtomicReference<CompletableFuture<ScheduleCatalog>> lastLoad =
        new AtomicReference<>(new CompletableFuture<>());

    public ScheduleCatalogService(SweepingProperties properties,
                                  ResourceLoader resourceLoader,
                                  @Qualifier("catalogLoaderExecutor") Executor loaderExecutor,
                                  Clock clock) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.loaderExecutor = loaderExecutor;
        this.clock = clock;
        this.current = new AtomicReference<>(ScheduleCatalog.empty(properties.getData().getLocation()));
    }

    @PostConstruct
    public void loadOnStartup() {
        if (properties.getData().isLoadOnStartup()) {
            reload();
        } else {
            log.info("Schedule catalog load on startup disabled");
        }
    }

    public ScheduleCatalog current() {
        return current.get();
    }

    /**
     * Future of the most recent load. Before any load has been started it never completes
     * on its own.
     */
    public CompletableFuture<ScheduleCatalog> ready() {
        return lastLoad.get();
    }

    /**
     * Loads the configured table in the background and swaps it in when done.
     */
    public CompletableFuture<ScheduleCatalog> reload() {
        String location = properties.getData().getLocation();
        CompletableFuture<ScheduleCatalog> load = CompletableFuture
            .supplyAsync(() -> loadFrom(location), loaderExecutor)
            .thenApply(catalog -> {
                current.set(catalog);
                return catalog;
            });

        CompletableFuture<ScheduleCatalog> previous = lastLoad.getAndSet(load);
        if (!previous.isDone()) {
            // Anyone waiting on the first load gets this one
            load.whenComplete((catalog, error) -> {
                if (error != null) {
                    previous.completeExceptionally(error);
                } else {
                    previous.complete(catalog);
                }
            });
        }
        return load;
    }

    ScheduleCatalog loadFrom(String location) {
        log.info("Loading schedule catalog from {}", location);
        long startTime = System.currentTimeMillis();

        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("Schedule table {} not found; serving without data", location);
            return ScheduleCatalog.empty(location);
        }

        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            ScheduleCatalog catalog = parse(reader, location);
            long duration = System.currentTimeMillis() - startTime;
            log.info("Schedule catalog loaded: {} rules, {} blocks, {} grid cells, {} rows rejected in {}ms",
                catalog.stats().ruleCount(), catalog.stats().blockCount(),
                catalog.stats().gridCellCount(), catalog.stats().rejectedRows(), duration);
            return catalog;
        } catch (IOException e) {
            log.error("Failed to read schedule table {}", location, e);
            return ScheduleCatalog.empty(location);
        }
    }

    /**
     * Parses and indexes a table. An unusable table yields the empty catalog.
     */
    public ScheduleCatalog parse(Reader reader, String source) throws IOException {
        ScheduleTableParser parser = new ScheduleTableParser(properties.getData().getDelimiter(), geometryParser);
        ScheduleTableParser.ParseResult result = parser.parse(reader);
        if (!result.usable()) {
            return ScheduleCatalog.empty(source);
        }
        return ScheduleCatalog.of(result.rules(), properties.getGrid().getCellSizeDegrees(),
            result.rejected(), clock.instant(), source);
    }
}
