package org.yourcompany.tetrisrules.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 名前付きルールの集合。
 * エンジンの各部品は自分専用のサブルールセットを持つことができ、
 * {@link #register(Ruleset)} によって「名前_」を接頭辞として親に取り込まれます。
 */
public final class Ruleset {

    private static final Logger log = LoggerFactory.getLogger(Ruleset.class);
    private static final Pattern VALID_NAME = Pattern.compile("[a-z][a-z0-9_]*");

    private final String name;
    private final Map<String, Rule> rules = new LinkedHashMap<>();

    public Ruleset(Rule... rules) {
        this(null, rules);
    }

    public Ruleset(String name, Rule... rules) {
        if (name != null && !VALID_NAME.matcher(name).matches()) {
            throw new ConfigurationException("invalid ruleset name: " + name);
        }
        this.name = name;
        for (Rule rule : rules) {
            if (!VALID_NAME.matcher(rule.getName()).matches()) {
                throw new ConfigurationException(rule + " does not have a valid name");
            }
            if (this.rules.putIfAbsent(rule.getName(), rule) != null) {
                throw new ConfigurationException("duplicate rule name: " + rule.getName());
            }
        }
    }

    public String getName() {
        return name;
    }

    public boolean contains(String ruleName) {
        return rules.containsKey(ruleName);
    }

    public Rule getRule(String ruleName) {
        Rule rule = rules.get(ruleName);
        if (rule == null) {
            throw new ConfigurationException("Ruleset has no rule named " + ruleName);
        }
        return rule;
    }

    public Object get(String ruleName) {
        return getRule(ruleName).getValue();
    }

    public <T> T get(String ruleName, Class<T> type) {
        Object value = get(ruleName);
        if (value != null && !type.isInstance(value)) {
            throw new ConfigurationException("rule " + ruleName + " is not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public int getInt(String ruleName) {
        return get(ruleName, Integer.class);
    }

    public boolean getBoolean(String ruleName) {
        return get(ruleName, Boolean.class);
    }

    public void set(String ruleName, Object value) {
        getRule(ruleName).setValue(value);
    }

    /**
     * 上書き値を適用します。登録されていない名前は無視します。
     */
    public void override(Map<String, ?> overrides) {
        for (Map.Entry<String, ?> entry : overrides.entrySet()) {
            Rule rule = rules.get(entry.getKey());
            if (rule != null) {
                rule.setValue(entry.getValue());
            }
        }
    }

    /**
     * 上書き値を適用します。登録されていない名前があれば {@link ConfigurationException} を投げます。
     */
    public void overrideStrict(Map<String, ?> overrides) {
        for (String key : overrides.keySet()) {
            if (!rules.containsKey(key)) {
                throw new ConfigurationException("unknown rule in overrides: " + key);
            }
        }
        override(overrides);
    }

    /**
     * サブルールセットを登録します。各ルールは「サブルールセット名_ルール名」で参照できるようになります。
     * ルールオブジェクトは共有されるため、どちらから値を変えても同じ値が見えます。
     */
    public void register(Ruleset sub) {
        if (sub.name == null || sub.name.isEmpty()) {
            throw new ConfigurationException("attempted registering an unnamed ruleset: " + sub);
        }
        String prefix = sub.name + "_";
        for (Rule rule : sub.rules.values()) {
            String prefixed = prefix + rule.getName();
            if (rules.containsKey(prefixed)) {
                throw new ConfigurationException(
                        "conflicting rule names: " + rule + ", " + rules.get(prefixed));
            }
        }
        for (Rule rule : sub.rules.values()) {
            rules.put(prefix + rule.getName(), rule);
        }
        log.debug("Registered ruleset '{}' ({} rules)", sub.name, sub.rules.size());
    }

    /**
     * {@link #register(Ruleset)} で取り込んだルールを取り除きます。
     */
    public void unregister(Ruleset sub) {
        if (sub.name == null) {
            return;
        }
        String prefix = sub.name + "_";
        for (Map.Entry<String, Rule> entry : sub.rules.entrySet()) {
            rules.remove(prefix + entry.getKey(), entry.getValue());
        }
    }

    /**
     * 現在の値のコピーを返します。
     */
    public Map<String, Object> values() {
        Map<String, Object> values = new LinkedHashMap<>();
        rules.forEach((key, rule) -> values.put(key, rule.getValue()));
        return values;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    @Override
    public String toString() {
        return "Ruleset" + (name != null ? "(" + name + ")" : "") + values();
    }
}
