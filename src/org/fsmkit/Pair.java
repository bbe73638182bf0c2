/*
 * @LICENSE@
 */
package org.fsmkit;

/**
 * An ordered pair of values; the state type of product constructions and of
 * relabelled operands. Two pairs are equal iff their components are.
 */
public final class Pair {

    private final Object l;
    private final Object r;

    public Pair(Object l, Object r) {
        assert l != null && r != null;
        this.l = l;
        this.r = r;
    }

    public Object l() {
        return l;
    }

    public Object r() {
        return r;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + l.hashCode();
        result = prime * result + r.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Pair))
            return false;
        final Pair other = (Pair) obj;
        return l.equals(other.l) && r.equals(other.r);
    }

    @Override
    public String toString() {
        return "<" + l + ", " + r + ">";
    }
}
