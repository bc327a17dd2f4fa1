/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language;

/**
    Grouping symbol. Round and curly brackets are interchangeable, so only the direction
    matters for equality. Brackets exist only in infix expressions.
**/
public class Bracket extends Token
{
    public final boolean open;
    public final String  symbol;

    public Bracket (String symbol, boolean open)
    {
        this.symbol = symbol;
        this.open   = open;
    }

    public static Factory factory (final String symbol, final boolean open)
    {
        return new Factory ()
        {
            public String name ()
            {
                return symbol;
            }

            public Token createInstance ()
            {
                return new Bracket (symbol, open);
            }
        };
    }

    public String toString ()
    {
        return symbol;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Bracket)) return false;
        return open == ((Bracket) that).open;
    }

    public int hashCode ()
    {
        return open ? 1 : 0;
    }
}
