/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.db;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
    A hierarchical key-value tree. Values are addressed by a path of keys, for example
    ("Differentiate", "maxDepth"). This base class stores nothing; see MVolatile for
    the in-memory implementation.

    A node can be "undefined". For the most part, this behaves as having a value of "".
**/
public class MNode implements Iterable<MNode>
{
    public String key ()
    {
        return "";
    }

    /**
        Returns the child indicated by the given key, or null if it doesn't exist.
        This function is separate from child(String...) for ease of implementing subclasses.
    **/
    protected MNode getChild (String key)
    {
        return null;
    }

    /**
        Returns a child node from arbitrary depth, or null if any part of the path doesn't exist.
    **/
    public synchronized MNode child (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            MNode c = result.getChild (key);
            if (c == null) return null;
            result = c;
        }
        return result;
    }

    /**
        Retrieves a child node from arbitrary depth, or creates it if nonexistent.
    **/
    public synchronized MNode childOrCreate (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            MNode c = result.getChild (key);
            if (c == null) c = result.set (null, key);
            result = c;
        }
        return result;
    }

    public int size ()
    {
        return 0;
    }

    /**
        Indicates whether this node is defined. get() returns "" for undefined nodes,
        so this is the only way to distinguish them from nodes that are defined as "".
    **/
    public boolean data ()
    {
        return false;
    }

    public String get ()
    {
        return getOrDefault ("");
    }

    /**
        Digs down tree as far as possible to retrieve value; returns "" if node does not exist.
    **/
    public String get (String... keys)
    {
        MNode c = child (keys);
        if (c == null) return "";
        return c.get ();
    }

    /**
        Returns this node's value, or the given default if node is undefined or set to "".
        This is the only get*() function that needs to be overridden by subclasses.
    **/
    public String getOrDefault (String defaultValue)
    {
        return defaultValue;
    }

    public String getOrDefault (String defaultValue, String... keys)
    {
        String value = get (keys);
        if (value.isEmpty ()) return defaultValue;
        return value;
    }

    /**
        A number written with a decimal point is rounded to the nearest integer.
    **/
    public int getOrDefault (int defaultValue, String... keys)
    {
        Double value = parseNumber (get (keys));
        if (value == null) return defaultValue;
        return (int) Math.round (value);
    }

    public int getInt (String... keys)
    {
        return getOrDefault (0, keys);
    }

    /**
        Interprets value as flag: false if "0" or non-existent, true otherwise (including empty).
    **/
    public boolean getFlag (String... keys)
    {
        MNode c = child (keys);
        if (c == null  ||  c.get ().equals ("0")) return false;
        return true;
    }

    /**
        Sets this node's own value. Passing null makes the node undefined.
    **/
    public void set (String value)
    {
    }

    /**
        Sets value of child node specified by key, creating the child if needed.
        @return The child node on which the value was set.
    **/
    public MNode set (String value, String key)
    {
        return new MNode ();
    }

    public synchronized MNode set (Object value, String... keys)
    {
        MNode result = childOrCreate (keys);
        String stringValue = null;
        if (value instanceof Boolean) stringValue = (Boolean) value ? "1" : "0";
        else if (value != null)       stringValue = value.toString ();
        result.set (stringValue);
        return result;
    }

    /**
        Deep copies the source node into this node, while leaving any non-overlapping values in
        this node unchanged. The value of this node is only replaced if the source value is defined.
    **/
    public synchronized void merge (MNode that)
    {
        if (that.data ()) set (that.get ());
        for (MNode thatChild : that)
        {
            String key = thatChild.key ();
            MNode c = getChild (key);
            if (c == null) c = set (null, key);
            c.merge (thatChild);
        }
    }

    public class IteratorWrapper implements Iterator<MNode>
    {
        Iterator<String> iterator;

        public IteratorWrapper (List<String> keys)
        {
            iterator = keys.iterator ();
        }

        public boolean hasNext ()
        {
            return iterator.hasNext ();
        }

        public MNode next ()
        {
            return getChild (iterator.next ());
        }
    }

    public Iterator<MNode> iterator ()
    {
        return new IteratorWrapper (new ArrayList<String> ());
    }

    /**
        Orders keys numerically when both are numbers, otherwise as strings. Numbers sort before strings.
    **/
    public static int compare (String A, String B)
    {
        if (A.equals (B)) return 0;

        Double Avalue = parseNumber (A);
        Double Bvalue = parseNumber (B);

        if (Avalue == null)
        {
            if (Bvalue == null) return A.compareTo (B);
            return 1;
        }
        if (Bvalue == null) return -1;
        return (int) Math.signum (Avalue - Bvalue);
    }

    /**
        @return The numeric value of the string, or null if it is not a number.
    **/
    public static Double parseNumber (String value)
    {
        if (value == null  ||  value.isEmpty ()) return null;
        try
        {
            return Double.valueOf (value.trim ());
        }
        catch (NumberFormatException e)
        {
            return null;
        }
    }

    public static class MOrder implements Comparator<String>
    {
        public int compare (String A, String B)
        {
            return MNode.compare (A, B);
        }
    }
    public static MOrder comparator = new MOrder ();

    /**
        Deep comparison of two nodes. All structure, keys and values must match exactly.
    **/
    @Override
    public boolean equals (Object o)
    {
        if (this == o) return true;
        if (! (o instanceof MNode)) return false;
        MNode that = (MNode) o;
        if (! key ().equals (that.key ())) return false;
        return equalsRecursive (that);
    }

    public boolean equalsRecursive (MNode that)
    {
        if (data () != that.data ()) return false;
        if (! get ().equals (that.get ())) return false;
        if (size () != that.size ()) return false;
        for (MNode a : this)
        {
            MNode b = that.getChild (a.key ());
            if (b == null) return false;
            if (! a.equalsRecursive (b)) return false;
        }
        return true;
    }

    @Override
    public int hashCode ()
    {
        return key ().hashCode ();
    }

    public String toString ()
    {
        StringWriter writer = new StringWriter ();
        try
        {
            Schema.latest ().write (this, writer, "");
        }
        catch (IOException e)
        {
            throw new IllegalStateException (e);  // StringWriter does not actually throw.
        }
        return writer.toString ();
    }
}
