package com.stockalerts.marketdata;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Maps engine symbols to vendor tickers.
 *
 * <p>Bare symbols get the configured exchange suffix ({@code TCS -> TCS.NS}). Symbols that
 * already carry a suffix ({@code INFY.BO}), index symbols ({@code ^NSEI}) and configured
 * passthrough symbols are returned upper-cased but otherwise unchanged.
 */
@Component
public class SymbolNormalizer {

    private final String exchangeSuffix;
    private final Set<String> passthrough;

    public SymbolNormalizer(MarketDataConfig config) {
        this.exchangeSuffix = config.getExchangeSuffix() == null ? "" : config.getExchangeSuffix();
        this.passthrough = config.getPassthroughSymbols().stream()
                .map(SymbolNormalizer::canonical)
                .collect(Collectors.toUnmodifiableSet());
    }

    /** Upper-cased, trimmed form used as the engine's symbol key. */
    public static String canonical(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    public String toTicker(String symbol) {
        String upper = canonical(symbol);
        if (upper.startsWith("^") || upper.contains(".") || passthrough.contains(upper)) {
            return upper;
        }
        return upper + exchangeSuffix;
    }
}
