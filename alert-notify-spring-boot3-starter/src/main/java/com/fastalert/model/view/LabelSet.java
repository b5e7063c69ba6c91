package com.fastalert.model.view;

import com.samskivert.mustache.Mustache;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 只读标签/注解集合
 * 派生视图中 alertname 排在最前, 其余按名称排序
 *
 * 模板中除了 {{Labels.alertname}} 这种按键取值外, 还可以使用
 * SortedPairs / Names / Values 三个派生视图
 */
public final class LabelSet implements Mustache.CustomContext {

    public static final String ALERTNAME = "alertname";

    private static final LabelSet EMPTY = new LabelSet(Collections.emptyMap());

    private final Map<String, String> kv;

    private LabelSet(Map<String, String> kv) {
        this.kv = Collections.unmodifiableMap(new TreeMap<>(kv));
    }

    public static LabelSet of(Map<String, String> kv) {
        return kv == null || kv.isEmpty() ? EMPTY : new LabelSet(kv);
    }

    public static LabelSet empty() {
        return EMPTY;
    }

    public String value(String name) {
        return kv.get(name);
    }

    public boolean containsKey(String name) {
        return kv.containsKey(name);
    }

    public int size() {
        return kv.size();
    }

    public boolean isEmpty() {
        return kv.isEmpty();
    }

    /** alertname 在前, 其余按名称排序 */
    public List<String> names() {
        List<String> names = new ArrayList<>(kv.size());
        if (kv.containsKey(ALERTNAME)) {
            names.add(ALERTNAME);
        }
        for (String k : kv.keySet()) {
            if (!ALERTNAME.equals(k)) {
                names.add(k);
            }
        }
        return names;
    }

    /** 与 names() 同序 */
    public List<String> values() {
        List<String> values = new ArrayList<>(kv.size());
        names().forEach(k -> values.add(kv.get(k)));
        return values;
    }

    public List<LabelPair> sortedPairs() {
        List<LabelPair> pairs = new ArrayList<>(kv.size());
        names().forEach(k -> pairs.add(new LabelPair(k, kv.get(k))));
        return pairs;
    }

    /** 去掉给定名称后的新集合 */
    public LabelSet remove(Collection<String> names) {
        Map<String, String> copy = new TreeMap<>(kv);
        names.forEach(copy::remove);
        return of(copy);
    }

    public Map<String, String> asMap() {
        return kv;
    }

    @Override
    public Object get(String name) throws Exception {
        switch (name) {
            case "SortedPairs":
                return sortedPairs();
            case "Names":
                return names();
            case "Values":
                return values();
            default:
                return kv.get(name);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelSet)) return false;
        return kv.equals(((LabelSet) o).kv);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kv);
    }

    @Override
    public String toString() {
        return kv.toString();
    }

    /**
     * 单个标签
     */
    public static final class LabelPair {

        private final String name;

        private final String value;

        public LabelPair(String name, String value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public String getValue() {
            return value;
        }

        @Override
        public String toString() {
            return name + "=" + value;
        }
    }
}
