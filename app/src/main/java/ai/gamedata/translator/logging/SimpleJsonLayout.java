package ai.gamedata.translator.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;

/**
 * One-line JSON rendering of a logging event. MDC entries (such as the data file being
 * processed) become top-level fields; a throwable is reduced to its class and message.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder builder = new StringBuilder(256);
        builder.append('{');
        appendField(builder, "timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        appendField(builder.append(','), "level", String.valueOf(event.getLevel()));
        appendField(builder.append(','), "logger", event.getLoggerName());
        appendField(builder.append(','), "message", event.getFormattedMessage());
        for (Map.Entry<String, String> entry : mdcOf(event).entrySet()) {
            appendField(builder.append(','), entry.getKey(), entry.getValue());
        }
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            appendField(builder.append(','), "error", throwable.getClassName() + ": " + throwable.getMessage());
        }
        builder.append('}');
        builder.append(System.lineSeparator());
        return builder.toString();
    }

    private static Map<String, String> mdcOf(ILoggingEvent event) {
        Map<String, String> map = event.getMDCPropertyMap();
        return map == null || map.isEmpty() ? Map.of() : new TreeMap<>(map);
    }

    private static void appendField(StringBuilder builder, String name, String value) {
        quote(builder, name);
        builder.append(':');
        quote(builder, value);
    }

    private static void quote(StringBuilder builder, String value) {
        if (value == null) {
            builder.append("null");
            return;
        }
        builder.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> builder.append("\\\\");
                case '"' -> builder.append("\\\"");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        builder.append(String.format("\\u%04x", (int) ch));
                    } else {
                        builder.append(ch);
                    }
                }
            }
        }
        builder.append('"');
    }
}
