package com.jay.formulaengine.layer1_data;

import com.jay.formulaengine.model.OHLCVBar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;
import org.ta4j.core.num.Num;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the indicator values formulas can reference (e.g. {@code AAPL.rsi_14}) from candle history.
 * Indicators whose look-back exceeds the available history are left out rather than reported as 0.
 */
@Slf4j
@Component
public class IndicatorCalculator {

    public Map<String, Double> compute(String symbol, List<OHLCVBar> bars) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (bars == null || bars.isEmpty()) return out;

        BarSeries series = buildSeries(symbol, bars);
        int n = series.getBarCount();
        if (n == 0) return out;
        int last = series.getEndIndex();

        ClosePriceIndicator close = new ClosePriceIndicator(series);
        VolumeIndicator volume = new VolumeIndicator(series);

        putIfReady(out, "sma_20", new SMAIndicator(close, 20), last, n >= 20);
        putIfReady(out, "sma_50", new SMAIndicator(close, 50), last, n >= 50);
        putIfReady(out, "ema_12", new EMAIndicator(close, 12), last, n >= 12);
        putIfReady(out, "ema_26", new EMAIndicator(close, 26), last, n >= 26);
        putIfReady(out, "rsi_14", new RSIIndicator(close, 14), last, n > 14);

        MACDIndicator macd = new MACDIndicator(close, 12, 26);
        putIfReady(out, "macd", macd, last, n >= 26);
        putIfReady(out, "macd_signal", new EMAIndicator(macd, 9), last, n >= 35);

        putIfReady(out, "avg_volume_20", new SMAIndicator(volume, 20), last, n >= 20);

        log.debug("Indicators for {} from {} bars: {}", symbol, n, out.keySet());
        return out;
    }

    private void putIfReady(Map<String, Double> out, String name, Indicator<Num> indicator, int index, boolean ready) {
        if (!ready) return;
        double value = indicator.getValue(index).doubleValue();
        if (!Double.isNaN(value) && !Double.isInfinite(value)) {
            out.put(name, value);
        }
    }

    // Bars with a non-increasing timestamp are dropped; ta4j refuses them.
    private BarSeries buildSeries(String symbol, List<OHLCVBar> bars) {
        BarSeries series = new BaseBarSeriesBuilder().withName(symbol).build();
        ZonedDateTime previous = null;
        for (OHLCVBar bar : bars.stream().sorted(Comparator.comparing(OHLCVBar::getTimestamp)).toList()) {
            ZonedDateTime end = bar.getTimestamp().atZone(ZoneId.systemDefault());
            if (previous != null && !end.isAfter(previous)) continue;
            series.addBar(end, bar.getOpen(), bar.getHigh(), bar.getLow(), bar.getClose(), bar.getVolume());
            previous = end;
        }
        return series;
    }
}
