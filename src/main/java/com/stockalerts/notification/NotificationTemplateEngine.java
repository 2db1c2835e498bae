package com.stockalerts.notification;

import com.stockalerts.calendar.MarketCalendar;
import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders alert notifications in Telegram HTML parse mode.
 *
 * <p>Times are shown in the exchange zone regardless of where the engine runs.
 */
@Component
public class NotificationTemplateEngine {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("dd MMM HH:mm:ss z", Locale.ENGLISH);

    private final MarketCalendar marketCalendar;

    public NotificationTemplateEngine(MarketCalendar marketCalendar) {
        this.marketCalendar = marketCalendar;
    }

    public String render(AlertNotification notification) {
        boolean up = notification.getMovePercent() != null && notification.getMovePercent().signum() > 0;
        String arrow = up ? "🔺" : "🔻"; // red triangle up / down

        StringBuilder text = new StringBuilder();
        text.append("🚨 <b>STOCK ALERT: ")
                .append(HtmlUtils.htmlEscape(notification.getSymbol()))
                .append("</b>\n\n");
        text.append("<b>Current Price:</b> ₹")
                .append(money(notification.getCurrentPrice()))
                .append('\n');
        text.append("<b>")
                .append(referenceLabel(notification))
                .append(":</b> ₹")
                .append(money(notification.getReferencePrice()))
                .append('\n');
        text.append("<b>Change:</b> ")
                .append(signedPercent(notification.getMovePercent()))
                .append(' ')
                .append(arrow)
                .append("\n\n");
        text.append("<b>Alert:</b> ")
                .append(HtmlUtils.htmlEscape(notification.getKind().describe()))
                .append(" of ")
                .append(notification.getThresholdPercent().abs().stripTrailingZeros().toPlainString())
                .append("%\n");
        text.append("<b>Alert ID:</b> #").append(notification.getAlertId()).append('\n');
        text.append("<b>Time:</b> ")
                .append(notification.getTriggeredAt().atZone(marketCalendar.getZone()).format(TIME_FORMAT));
        if (notification.isStalePrice()) {
            text.append("\n<i>Price feed unavailable, last cached price used.</i>");
        }
        return text.toString();
    }

    private static String referenceLabel(AlertNotification notification) {
        return switch (notification.getKind().getType()) {
            case GAP_UP, GAP_DOWN -> "Previous Close";
            case DROP_WINDOW -> notification.getKind().getWindowMinutes() + "m High";
            case SPIKE_WINDOW -> notification.getKind().getWindowMinutes() + "m Low";
        };
    }

    private static String money(BigDecimal value) {
        if (value == null) {
            return "-";
        }
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.ENGLISH));
        return format.format(value);
    }

    private static String signedPercent(BigDecimal value) {
        if (value == null) {
            return "-";
        }
        return (value.signum() > 0 ? "+" : "") + value.toPlainString() + "%";
    }
}
