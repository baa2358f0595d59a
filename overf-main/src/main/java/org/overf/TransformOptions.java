package org.overf;

import com.github.javaparser.JavaParser;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import javax.lang.model.SourceVersion;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Settings of the transformer: which labels mark policy blocks, what propagation returns and
 * which runtime classes the generated code calls. Instances are immutable.
 */
public final class TransformOptions {

    private static final String ROOT = "overf";

    private final Map<OverflowPolicy, String> labels;
    private final Map<String, OverflowPolicy> policiesByLabel;
    private final String absentValue;
    private final String handlerVariable;
    private final String arithmeticClass;
    private final String signalClass;

    private TransformOptions(Builder builder) {
        this.labels = Collections.unmodifiableMap(new EnumMap<>(builder.labels));
        Map<String, OverflowPolicy> byLabel = new LinkedHashMap<>();
        for (Map.Entry<OverflowPolicy, String> entry : labels.entrySet()) {
            OverflowPolicy previous = byLabel.put(entry.getValue(), entry.getKey());
            if (previous != null) {
                throw new IllegalArgumentException("Label '" + entry.getValue() + "' is used for both "
                                                   + previous + " and " + entry.getKey());
            }
        }
        this.policiesByLabel = Collections.unmodifiableMap(byLabel);
        this.absentValue = builder.absentValue;
        this.handlerVariable = builder.handlerVariable;
        this.arithmeticClass = builder.arithmeticClass;
        this.signalClass = builder.signalClass;
    }

    /**
     * Options from {@code ConfigFactory.load()}, i.e. the bundled {@code reference.conf} with
     * any {@code application.conf} and system property overrides.
     */
    public static TransformOptions load() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads the {@code overf} section of {@code config}. Missing keys fall back to the bundled
     * defaults.
     */
    public static TransformOptions fromConfig(Config config) {
        Config overf = config.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT);
        return builder()
                .label(OverflowPolicy.CHECKED, overf.getString("labels.checked"))
                .label(OverflowPolicy.OVERFLOWING, overf.getString("labels.overflowing"))
                .label(OverflowPolicy.SATURATING, overf.getString("labels.saturating"))
                .label(OverflowPolicy.PROPAGATING, overf.getString("labels.propagating"))
                .label(OverflowPolicy.DEFAULT, overf.getString("labels.reset"))
                .absentValue(overf.getString("propagation.absent-value"))
                .handlerVariable(overf.getString("propagation.handler-variable"))
                .arithmeticClass(overf.getString("runtime.arithmetic-class"))
                .signalClass(overf.getString("runtime.signal-class"))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.labels.putAll(labels);
        builder.absentValue = absentValue;
        builder.handlerVariable = handlerVariable;
        builder.arithmeticClass = arithmeticClass;
        builder.signalClass = signalClass;
        return builder;
    }

    /**
     * @return the label that marks {@code policy}; for {@link OverflowPolicy#DEFAULT} this is
     * the reset label
     */
    public String getLabel(OverflowPolicy policy) {
        return labels.get(policy);
    }

    public Optional<OverflowPolicy> policyForLabel(String label) {
        return Optional.ofNullable(policiesByLabel.get(label));
    }

    public Map<String, OverflowPolicy> getPoliciesByLabel() {
        return policiesByLabel;
    }

    public String getAbsentValue() {
        return absentValue;
    }

    public String getHandlerVariable() {
        return handlerVariable;
    }

    public String getArithmeticClass() {
        return arithmeticClass;
    }

    public String getSignalClass() {
        return signalClass;
    }

    @Override
    public String toString() {
        return "TransformOptions{" +
               "labels=" + labels +
               ", absentValue='" + absentValue + '\'' +
               ", arithmeticClass='" + arithmeticClass + '\'' +
               '}';
    }

    public static final class Builder {

        private final Map<OverflowPolicy, String> labels = new EnumMap<>(OverflowPolicy.class);
        private String absentValue = "java.util.Optional.empty()";
        private String handlerVariable = "overflow$";
        private String arithmeticClass = "org.overf.runtime.OverflowArithmetic";
        private String signalClass = "org.overf.runtime.OverflowSignal";

        private Builder() {
            labels.put(OverflowPolicy.CHECKED, "checked");
            labels.put(OverflowPolicy.OVERFLOWING, "overflowing");
            labels.put(OverflowPolicy.SATURATING, "saturating");
            labels.put(OverflowPolicy.PROPAGATING, "propagating");
            labels.put(OverflowPolicy.DEFAULT, "defaults");
        }

        public Builder label(OverflowPolicy policy, String label) {
            labels.put(policy, requireIdentifier(label, "label for " + policy));
            return this;
        }

        public Builder absentValue(String absentValue) {
            if (!new JavaParser().parseExpression(absentValue).isSuccessful()) {
                throw new IllegalArgumentException("Absent value is not a Java expression: " + absentValue);
            }
            this.absentValue = absentValue;
            return this;
        }

        public Builder handlerVariable(String handlerVariable) {
            this.handlerVariable = requireIdentifier(handlerVariable, "handler variable");
            return this;
        }

        public Builder arithmeticClass(String arithmeticClass) {
            this.arithmeticClass = requireQualifiedName(arithmeticClass, "arithmetic class");
            return this;
        }

        public Builder signalClass(String signalClass) {
            this.signalClass = requireQualifiedName(signalClass, "signal class");
            return this;
        }

        public TransformOptions build() {
            return new TransformOptions(this);
        }

        private static String requireIdentifier(String value, String what) {
            if (value == null || !SourceVersion.isIdentifier(value) || SourceVersion.isKeyword(value)) {
                throw new IllegalArgumentException("Invalid " + what + ": '" + value + "' is not a Java identifier");
            }
            return value;
        }

        private static String requireQualifiedName(String value, String what) {
            if (value == null || !SourceVersion.isName(value)) {
                throw new IllegalArgumentException("Invalid " + what + ": '" + value + "' is not a qualified name");
            }
            return value;
        }
    }
}
