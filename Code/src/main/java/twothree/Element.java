package twothree;

/**
 * A key/value pair stored in a {@link TwoThreeTree}.
 * Equality and ordering look at the key only.
 *
 * The tree itself only ever uses {@link #compareTo}. {@link #equals} and
 * {@link #hashCode} delegate to the key's own equals/hashCode, so for keys whose
 * natural ordering is inconsistent with equals (BigDecimal 2.0 and 2.00) two
 * elements can compare as 0 without being equal. The tree treats such keys as
 * the same key.
 */
public final class Element<K extends Comparable<? super K>, V> implements Comparable<Element<K,V>> {
    final K key;
    final V value;

    /** PRECONDITION: key CANNOT BE NULL **/
    public Element(final K key, final V value) {
        if (key == null) throw new NullPointerException("key");
        this.key = key;
        this.value = value;
    }

    public K getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    @Override
    public int compareTo(final Element<K,V> other) {
        return key.compareTo(other.key);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof Element)) return false;
        return key.equals(((Element<?,?>) o).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
