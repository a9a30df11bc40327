package org.yourcompany.tetrisrules.config;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link Ruleset} に登録される 1 つのルール。
 * 受け付ける型が決まっており、型の合わない値を代入すると {@link ConfigurationException} になります。
 */
public final class Rule {

    private final String name;
    private final List<Class<?>> types;
    private final boolean nullable;
    private final Object defaultValue;
    private Object value;

    public Rule(String name, Class<?> type, Object defaultValue) {
        this(name, false, defaultValue, type);
    }

    public Rule(String name, boolean nullable, Object defaultValue, Class<?>... types) {
        if (types.length == 0) {
            throw new ConfigurationException("rule " + name + " must accept at least one type");
        }
        this.name = name;
        this.types = List.of(types);
        this.nullable = nullable;
        if (!accepts(defaultValue)) {
            throw new ConfigurationException("default " + defaultValue + " has incompatible type for " + this);
        }
        this.defaultValue = defaultValue;
        this.value = defaultValue;
    }

    /**
     * null を許容するルールを作成します。
     */
    public static Rule nullable(String name, Class<?> type, Object defaultValue) {
        return new Rule(name, true, defaultValue, type);
    }

    public boolean accepts(Object candidate) {
        if (candidate == null) {
            return nullable;
        }
        for (Class<?> type : types) {
            if (type.isInstance(candidate)) {
                return true;
            }
        }
        return false;
    }

    public void setValue(Object newValue) {
        if (!accepts(newValue)) {
            throw new ConfigurationException(newValue + " has incompatible type for " + this);
        }
        this.value = newValue;
    }

    public void reset() {
        this.value = defaultValue;
    }

    public String getName() { return name; }
    public List<Class<?>> getTypes() { return types; }
    public boolean isNullable() { return nullable; }
    public Object getDefaultValue() { return defaultValue; }
    public Object getValue() { return value; }

    @Override
    public String toString() {
        String typeNames = types.stream().map(Class::getSimpleName).collect(Collectors.joining("|"));
        return "Rule(" + name + ": " + typeNames + (nullable ? "?" : "") + " = " + value + ")";
    }
}
