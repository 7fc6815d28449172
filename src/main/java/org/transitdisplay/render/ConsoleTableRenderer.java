package org.transitdisplay.render;

import org.transitdisplay.errors.RenderException;
import org.transitdisplay.interfaces.Renderer;
import org.transitdisplay.model.Departure;
import org.transitdisplay.model.Snapshot;
import org.transitdisplay.model.Source;
import org.transitdisplay.model.WeatherReading;

import java.io.PrintStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders snapshots as a plain text board on a {@link PrintStream}:
 * a clock line, a weather line and a departures table.
 */
public final class ConsoleTableRenderer implements Renderer {

    private static final DateTimeFormatter CLOCK =
            DateTimeFormatter.ofPattern("EEE dd.MM.yyyy  HH:mm", Locale.GERMANY);
    private static final String ROW = "%-6s %-32s %5s %4s%n";
    private static final int DESTINATION_WIDTH = 32;

    private final PrintStream out;
    private final ZoneId zone;

    public ConsoleTableRenderer(PrintStream out, ZoneId zone) {
        this.out = Objects.requireNonNull(out, "out");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Override
    public void render(Snapshot snapshot) throws RenderException {
        StringBuilder sb = new StringBuilder();
        sb.append(CLOCK.format(snapshot.takenAt().atZone(zone))).append(System.lineSeparator());
        sb.append(weatherLine(snapshot)).append(System.lineSeparator());
        sb.append(String.format(ROW, "Line", "Destination", "Time", "Delay"));

        List<Departure> departures = snapshot.get(Source.TRIPS).orElse(List.of());
        if (departures.isEmpty()) {
            sb.append("(waiting for departures)").append(System.lineSeparator());
        }
        for (Departure d : departures) {
            sb.append(String.format(ROW, d.line(), truncate(d.destination(), DESTINATION_WIDTH),
                    d.timeLabel(), d.delayLabel()));
        }

        out.print(sb);
        out.flush();
        if (out.checkError()) {
            throw new RenderException("output stream reported an error while rendering");
        }
    }

    @Override
    public void renderError(String message) {
        out.println("!!! ERROR !!!");
        out.println(message == null ? "unknown error" : message);
        out.flush();
    }

    static String weatherLine(Snapshot snapshot) {
        return snapshot.get(Source.WEATHER)
                .map(ConsoleTableRenderer::formatWeather)
                .orElse("Weather: --");
    }

    private static String formatWeather(WeatherReading w) {
        return String.format(Locale.ROOT, "Weather: %.1f°C (%.1f / %.1f)  UV %.1f (max %.1f)",
                w.temperature(), w.temperatureDailyMin(), w.temperatureDailyMax(),
                w.uvIndex(), w.uvIndexDailyMax());
    }

    static String truncate(String text, int max) {
        if (text.length() <= max) return text;
        return text.substring(0, Math.max(0, max - 1)) + "…";
    }
}
