package com.adobe.numeral.service;

import com.adobe.numeral.converter.RomanNumeralConverter;
import com.adobe.numeral.converter.RomanOptions;
import com.adobe.numeral.model.ConversionResult;
import com.adobe.numeral.model.RangeConversionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.stream.LongStream;

/**
 * Parallel processor for range-based Roman numeral encoding.
 * 
 * <p>Each value of the range is encoded independently with the same options,
 * using a parallel stream over the common ForkJoinPool. The encoder is a pure
 * function of its input and the static symbol tables, so no coordination is
 * needed between workers.</p>
 * 
 * <h2>Ordering:</h2>
 * <p>{@code LongStream.rangeClosed} is an ordered source and {@code toList()}
 * keeps encounter order, so results come back ascending without a sort.</p>
 * 
 * <h2>Complexity:</h2>
 * <ul>
 *   <li>Time: O(n/p) where n = range size, p = parallelism</li>
 *   <li>Space: O(n) for storing results</li>
 * </ul>
 * 
 * @author Adobe AEM Engineering Assessment
 * @version 2.0.0
 */
@Component
public class ParallelRangeProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ParallelRangeProcessor.class);
    
    private final RomanNumeralConverter converter;
    private final int maxRangeSize;
    
    private final Timer rangeProcessingTimer;
    private final Counter rangeRequestsCounter;
    private final DistributionSummary rangeSizeDistribution;

    /**
     * Constructs the processor with the required converter and metrics registry.
     * 
     * @param converter     the Roman numeral converter to use
     * @param meterRegistry the Micrometer registry for metrics
     * @param maxRangeSize  largest accepted range, bounds the work per request
     */
    public ParallelRangeProcessor(RomanNumeralConverter converter,
                                  MeterRegistry meterRegistry,
                                  @Value("${app.range.max-size:1000}") int maxRangeSize) {
        this.converter = converter;
        this.maxRangeSize = maxRangeSize;
        
        this.rangeProcessingTimer = Timer.builder("range.processing.time")
            .description("Time taken to process range conversion requests")
            .tag("processor", "parallel-stream")
            .register(meterRegistry);
        
        this.rangeRequestsCounter = Counter.builder("range.requests.total")
            .description("Total number of range conversion requests")
            .register(meterRegistry);
        
        this.rangeSizeDistribution = DistributionSummary.builder("range.processing.size")
            .description("Distribution of range sizes requested")
            .baseUnit("items")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
        
        logger.info("ParallelRangeProcessor initialized (max range size {})", maxRangeSize);
    }

    /**
     * Encodes every integer in {@code [min, max]} and returns them in ascending order.
     * 
     * @param min     the minimum value (inclusive)
     * @param max     the maximum value (inclusive)
     * @param options rendering options applied to every value
     * @return RangeConversionResult with ordered conversions
     * @throws IllegalArgumentException if the range is invalid
     * @throws com.adobe.numeral.exception.ConfigurationException if any value cannot be expressed
     */
    public RangeConversionResult processRange(long min, long max, RomanOptions options) {
        validateRange(min, max);
        
        long rangeSize = max - min + 1;
        rangeRequestsCounter.increment();
        rangeSizeDistribution.record(rangeSize);
        
        logger.debug("Processing range [{}, {}] with {} values using parallel streams", 
            min, max, rangeSize);

        long startTime = System.nanoTime();
        
        List<ConversionResult> results = LongStream.rangeClosed(min, max)
            .parallel()
            .mapToObj(number -> ConversionResult.encoded(number, converter.encode(number, options)))
            .toList();
        
        long durationNanos = System.nanoTime() - startTime;
        rangeProcessingTimer.record(Duration.ofNanos(durationNanos));
        
        logger.info("Processed {} conversions in {}ms using parallel streams", 
            rangeSize, durationNanos / 1_000_000);
        
        return RangeConversionResult.of(results);
    }

    /**
     * Validates the range parameters.
     * 
     * <h3>Validation Rules:</h3>
     * <ul>
     *   <li>min must be strictly less than max</li>
     *   <li>Range size must not exceed the configured maximum</li>
     * </ul>
     * 
     * @param min the minimum value
     * @param max the maximum value
     * @throws IllegalArgumentException if validation fails
     */
    private void validateRange(long min, long max) {
        if (min >= max) {
            throw new IllegalArgumentException(
                String.format("min (%d) must be less than max (%d)", min, max));
        }
        
        // max - min overflows for ranges spanning most of the long domain
        long rangeSize = max - min + 1;
        if (rangeSize <= 0 || rangeSize > maxRangeSize) {
            throw new IllegalArgumentException(
                String.format("Range size exceeds maximum allowed (%d). " +
                    "Please request a smaller range.", maxRangeSize));
        }
    }
}
