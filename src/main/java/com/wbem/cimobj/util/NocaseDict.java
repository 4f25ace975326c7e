package com.wbem.cimobj.util;

import com.wbem.cimobj.exception.CIMTypeException;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered mapping with case-insensitive string keys.
 *
 * <p>Keys keep the case they were last stored with, lookups ignore case, and iteration
 * follows insertion order. Replacing the value of an existing key keeps its position.
 * A single entry with a {@code null} key is permitted when the dictionary is created
 * with {@code allowUnnamedKeys}.
 *
 * <p>Equality is order independent and uses {@link CimEquality#valuesEqual} for the
 * values, so two dictionaries with the same entries in different order are equal and
 * hash alike.
 *
 * <p>Compared with a plain {@link Map}, equality is not symmetric: a {@code NocaseDict}
 * compares values with {@link CimEquality}, while the plain map applies its own key and
 * value equality. So {@code dict.equals(hashMap)} may be true where
 * {@code hashMap.equals(dict)} is false.
 * Compare dictionaries with dictionaries where symmetry matters.
 *
 * @param <V> value type
 */
public class NocaseDict<V> extends AbstractMap<String, V> {

    private final LinkedHashMap<String, Map.Entry<String, V>> data = new LinkedHashMap<>();
    private final boolean allowUnnamedKeys;

    public NocaseDict() {
        this(false);
    }

    public NocaseDict(boolean allowUnnamedKeys) {
        this.allowUnnamedKeys = allowUnnamedKeys;
    }

    public NocaseDict(Map<String, ? extends V> entries) {
        this(false);
        putAll(entries);
    }

    public boolean isAllowUnnamedKeys() {
        return allowUnnamedKeys;
    }

    private String lookupKey(Object key) {
        if (key == null) {
            if (!allowUnnamedKeys) {
                throw new CIMTypeException("NocaseDict key null (unnamed key) is not allowed");
            }
            return null;
        }
        if (!(key instanceof String)) {
            throw new CIMTypeException("NocaseDict key " + key + " must be a string, but is "
                + key.getClass().getName());
        }
        return CimEquality.lower((String) key);
    }

    @Override
    public V get(Object key) {
        Map.Entry<String, V> entry = data.get(lookupKey(key));
        return entry == null ? null : entry.getValue();
    }

    @Override
    public boolean containsKey(Object key) {
        if (key != null && !(key instanceof String)) {
            return false;
        }
        if (key == null && !allowUnnamedKeys) {
            return false;
        }
        return data.containsKey(lookupKey(key));
    }

    @Override
    public V put(String key, V value) {
        Map.Entry<String, V> previous = data.put(lookupKey(key), new SimpleEntry<>(key, value));
        return previous == null ? null : previous.getValue();
    }

    @Override
    public V remove(Object key) {
        if (!containsKey(key)) {
            return null;
        }
        return data.remove(lookupKey(key)).getValue();
    }

    @Override
    public int size() {
        return data.size();
    }

    @Override
    public void clear() {
        data.clear();
    }

    /**
     * Returns the key as stored, for a key given in any case.
     */
    public String getStoredKey(String key) {
        Map.Entry<String, V> entry = data.get(lookupKey(key));
        return entry == null ? null : entry.getKey();
    }

    /**
     * Keys in insertion order, in the case they were stored with.
     */
    public List<String> keys() {
        List<String> keys = new ArrayList<>(data.size());
        for (Map.Entry<String, V> entry : data.values()) {
            keys.add(entry.getKey());
        }
        return keys;
    }

    /**
     * Shallow copy: a new dictionary with the same keys and value references.
     */
    public NocaseDict<V> copy() {
        NocaseDict<V> copy = new NocaseDict<>(allowUnnamedKeys);
        for (Map.Entry<String, V> entry : data.values()) {
            copy.put(entry.getKey(), entry.getValue());
        }
        return copy;
    }

    @Override
    public Set<Map.Entry<String, V>> entrySet() {
        return new AbstractSet<>() {
            @Override
            public Iterator<Map.Entry<String, V>> iterator() {
                return data.values().iterator();
            }

            @Override
            public int size() {
                return data.size();
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Map<?, ?> other)) {
            return false;
        }
        if (other.size() != size()) {
            return false;
        }
        for (Map.Entry<String, V> entry : data.values()) {
            if (entry.getKey() == null && other instanceof NocaseDict<?> dict && !dict.allowUnnamedKeys) {
                return false;
            }
            if (!other.containsKey(entry.getKey())) {
                return false;
            }
            if (!CimEquality.valuesEqual(entry.getValue(), other.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Map.Entry<String, V> entry : data.values()) {
            hash += CimEquality.nameHash(entry.getKey()) ^ CimEquality.valueHash(entry.getValue());
        }
        return hash;
    }
}
