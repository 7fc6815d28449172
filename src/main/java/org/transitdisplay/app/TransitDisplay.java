package org.transitdisplay.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitdisplay.client.BvgDepartureClient;
import org.transitdisplay.client.MultiStationTripFetcher;
import org.transitdisplay.client.NmcliNetworkLink;
import org.transitdisplay.client.OpenMeteoWeatherClient;
import org.transitdisplay.client.ProcessCommandRunner;
import org.transitdisplay.config.DisplaySettings;
import org.transitdisplay.config.StationConfigLoader;
import org.transitdisplay.interfaces.Fetcher;
import org.transitdisplay.interfaces.NetworkLink;
import org.transitdisplay.interfaces.Renderer;
import org.transitdisplay.interfaces.Sleeper;
import org.transitdisplay.interfaces.UpdateSignal;
import org.transitdisplay.model.Departure;
import org.transitdisplay.model.DepartureKey;
import org.transitdisplay.model.Source;
import org.transitdisplay.model.Station;
import org.transitdisplay.model.WeatherReading;
import org.transitdisplay.render.ConsoleTableRenderer;
import org.transitdisplay.runtime.ConnectivityWatchdog;
import org.transitdisplay.runtime.DisplayRuntime;
import org.transitdisplay.runtime.MinuteTicker;
import org.transitdisplay.runtime.ProducerLoop;
import org.transitdisplay.runtime.RenderLoop;
import org.transitdisplay.store.SharedStateStore;
import org.transitdisplay.util.AnchoredIntervalSchedule;
import org.transitdisplay.util.CoalescingUpdateSignal;
import org.transitdisplay.util.EqualityChangeDetector;
import org.transitdisplay.util.FixedIntervalSchedule;
import org.transitdisplay.util.KeyedSetChangeDetector;
import org.transitdisplay.util.UntilSuccessRetryExecutor;

import java.time.Clock;
import java.util.List;

/**
 * Entry point: wires the producer loops, ticker, watchdog and render loop,
 * then waits for a fatal error.
 * <pre>
 * java -Dtransit.stationsFile=stations.json -jar transit-display.jar
 * </pre>
 */
public final class TransitDisplay {

    private static final Logger log = LoggerFactory.getLogger(TransitDisplay.class);

    private TransitDisplay() {}

    public static void main(String[] args) throws Exception {
        DisplaySettings settings = DisplaySettings.fromSystemProperties();
        List<Station> stations = StationConfigLoader.loadOrDefault(settings.stationsFile());
        Renderer renderer = new ConsoleTableRenderer(System.out, settings.zone());

        Sleeper sleeper = Sleeper.SYSTEM;
        BvgDepartureClient bvg = new BvgDepartureClient();
        Fetcher<List<Departure>> trips = new MultiStationTripFetcher(stations, bvg,
                s -> UntilSuccessRetryExecutor.fixed(s.name(), settings.tripRetryDelay(), sleeper));
        Fetcher<WeatherReading> weather =
                new OpenMeteoWeatherClient(settings.latitude(), settings.longitude(), settings.zone());
        NetworkLink link = new NmcliNetworkLink(new ProcessCommandRunner(30), null);

        log.info("[Main] starting transit display with {} station(s)", stations.size());
        DisplayRuntime runtime = assemble(settings, trips, weather, link, renderer, Clock.systemUTC(), sleeper);
        runtime.start();

        Throwable fatal = runtime.awaitFatal();
        log.error("[Main] display loop failed", fatal);
        try {
            renderer.renderError(String.valueOf(fatal.getMessage()));
        } catch (RuntimeException e) {
            log.error("[Main] error screen could not be shown: {}", e.getMessage());
        }
        runtime.shutdown();
        System.exit(1);
    }

    /**
     * Builds the runtime without starting it.
     */
    public static DisplayRuntime assemble(DisplaySettings settings,
                                          Fetcher<List<Departure>> trips,
                                          Fetcher<WeatherReading> weather,
                                          NetworkLink link,
                                          Renderer renderer,
                                          Clock clock,
                                          Sleeper sleeper) {
        SharedStateStore store = new SharedStateStore();
        // raised initially so the first render happens right away
        UpdateSignal signal = new CoalescingUpdateSignal(true);

        ProducerLoop<List<Departure>> tripLoop = new ProducerLoop<>(
                Source.TRIPS,
                trips,
                UntilSuccessRetryExecutor.fixed("trips", settings.tripRetryDelay(), sleeper),
                new KeyedSetChangeDetector<Departure, DepartureKey, List<Departure>>(Departure::key),
                store.claimWriter(Source.TRIPS),
                signal,
                new FixedIntervalSchedule<>(settings.tripInterval()),
                clock,
                sleeper);

        ProducerLoop<WeatherReading> weatherLoop = new ProducerLoop<>(
                Source.WEATHER,
                weather,
                UntilSuccessRetryExecutor.fixed("weather", settings.weatherRetryDelay(), sleeper),
                new EqualityChangeDetector<>(),
                store.claimWriter(Source.WEATHER),
                signal,
                new AnchoredIntervalSchedule<>(WeatherReading::observedAt,
                        settings.weatherPeriod(), settings.weatherOffset(), settings.weatherFallback()),
                clock,
                sleeper);

        RenderLoop renderLoop = new RenderLoop(store, signal, renderer, settings.renderMaxIdle(), clock);

        DisplayRuntime runtime = new DisplayRuntime()
                .loop("trips-producer", tripLoop::run)
                .loop("weather-producer", weatherLoop::run)
                .loop("minute-ticker", new MinuteTicker(signal, clock, sleeper)::run)
                .loop("render-consumer", renderLoop::run);

        if (settings.watchdogEnabled()) {
            ConnectivityWatchdog watchdog = new ConnectivityWatchdog(link,
                    settings.watchdogInterval(),
                    settings.watchdogInitialDelay(),
                    new ConnectivityWatchdog.ReconnectPolicy(settings.reconnectDelay(),
                            settings.reconnectEscalateAfter(),
                            settings.reconnectEscalatedDelay(),
                            settings.reconnectMaxAttempts()),
                    sleeper);
            runtime.loop("connectivity-watchdog", watchdog::run);
        }
        return runtime;
    }
}
