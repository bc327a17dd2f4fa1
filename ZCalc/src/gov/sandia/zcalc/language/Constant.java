/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language;

import gov.sandia.zcalc.language.type.Complex;

public class Constant extends Token
{
    public final Complex value;

    public Constant (Complex value)
    {
        this.value = value;
    }

    public Constant (double value)
    {
        this.value = new Complex (value);
    }

    public String toString ()
    {
        return value.toString ();
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Constant)) return false;
        Constant c = (Constant) that;
        return value.equals (c.value);
    }

    public int hashCode ()
    {
        return value.hashCode ();
    }
}
