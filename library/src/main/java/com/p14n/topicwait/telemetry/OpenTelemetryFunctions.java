package com.p14n.topicwait.telemetry;

import java.util.function.Supplier;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Helpers for running work inside an OpenTelemetry span.
 */
public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        /**
         * Runs {@code action} inside a new span with no attributes.
         *
         * @param tracer   Tracer that creates the span
         * @param spanName Name of the span
         * @param action   Work to run while the span is current
         * @param <T>      Result type of the action
         * @return The action's result
         */
        public static <T> T processWithTelemetry(Tracer tracer, String spanName,
                                                 Supplier<T> action) {
                return processWithTelemetry(tracer, spanName, Attributes.empty(), action);
        }

        /**
         * Runs {@code action} inside a new span carrying {@code attributes}. A
         * runtime exception is recorded on the span and rethrown.
         *
         * @param tracer     Tracer that creates the span
         * @param spanName   Name of the span
         * @param attributes Attributes set on the span before it starts
         * @param action     Work to run while the span is current
         * @param <T>        Result type of the action
         * @return The action's result
         */
        public static <T> T processWithTelemetry(Tracer tracer, String spanName, Attributes attributes,
                                                 Supplier<T> action) {

                Span span = tracer.spanBuilder(spanName)
                                .setAllAttributes(attributes)
                                .startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }

}
