/*
 * @LICENSE@
 */

package org.fsmkit;

import java.util.AbstractQueue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods. Most of them are the value based
 * set operations on ordered collections that the automaton code is built on:
 * membership is always decided by <code>equals()</code>, never by identity.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");
    public static final String FS = System.getProperty("file.separator");

    static boolean contains(Collection<?> c, Object o) {
        for (Object e : c) {
            if (e.equals(o)) return true;
        }
        return false;
    }

    /*
     * true iff o occurs in list at an index >= from
     */
    static boolean containsFrom(List<?> list, Object o, int from) {
        for (int i = from; i < list.size(); ++i) {
            if (list.get(i).equals(o)) return true;
        }
        return false;
    }

    static boolean containsAll(Collection<?> lhs, Collection<?> rhs) {
        for (Object o : rhs) {
            if (!contains(lhs, o)) return false;
        }
        return true;
    }

    static boolean containsAny(Collection<?> lhs, Collection<?> rhs) {
        for (Object o : rhs) {
            if (contains(lhs, o)) return true;
        }
        return false;
    }

    /**
     * Set equality of two collections: same size, and every element of one
     * is an element of the other. Order is irrelevant.
     */
    static boolean areEqualSets(Collection<?> lhs, Collection<?> rhs) {
        return lhs.size() == rhs.size() && containsAll(lhs, rhs)
                && containsAll(rhs, lhs);
    }

    /**
     * Ordered union: the elements of <code>lhs</code> followed by those of
     * <code>rhs</code>, each included exactly once.
     */
    static <T> List<T> union(Collection<? extends T> lhs,
            Collection<? extends T> rhs) {
        List<T> ret = new ArrayList<T>(lhs.size() + rhs.size());
        for (T t : lhs) if (!contains(ret, t)) ret.add(t);
        for (T t : rhs) if (!contains(ret, t)) ret.add(t);
        return ret;
    }

    static boolean hasDuplicates(List<?> list) {
        for (int i = 0; i < list.size(); ++i) {
            if (containsFrom(list, list.get(i), i + 1)) return true;
        }
        return false;
    }

    /*
     * hands out single bit flags; check rejects any bit not handed out
     */
    static final class FlagMgr {

        private int count = 0;
        private int defined = 0;
        private boolean frozen = false;

        int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagMgr: " + label);
            int flag = 1 << count++;
            defined |= flag;
            return flag;
        }

        int freezeAndCount() {
            frozen = true;
            return count;
        }

        void check(int flags) {
            if ((flags & ~defined) != 0) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            }
        }
    }

    static boolean isSet(int flags, int flag) {
        return (flags & flag) != 0;
    }

    /**
     * A FIFO work queue which accepts each element at most once over its
     * whole lifetime: an element that was already offered (whether still
     * pending or already polled) is refused. This is the "gray + black"
     * bookkeeping of a breadth first search, by value.
     */
    static final class WorkQueue<E> extends AbstractQueue<E> {

        private final Set<E> seen = new HashSet<E>();
        private final LinkedList<E> list = new LinkedList<E>();

        WorkQueue() {
            super();
        }
        WorkQueue(Collection<? extends E> c) {
            this();
            addAll(c);
        }
        @Override
        public Iterator<E> iterator() {
            return list.iterator();
        }

        @Override
        public int size() {
            return list.size();
        }

        public boolean offer(E o) {
            if (o == null || !seen.add(o)) return false;
            return list.offer(o);
        }

        /*
         * refusal is not an error here, so addAll() can be used freely
         */
        @Override
        public boolean add(E o) {
            return offer(o);
        }

        public E peek() {
            return list.peek();
        }

        public E poll() {
            return list.poll();
        }

        boolean seen(Object o) {
            return seen.contains(o);
        }
    }
}
