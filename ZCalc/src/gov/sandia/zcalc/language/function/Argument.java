/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language.function;

import gov.sandia.zcalc.language.Function;
import gov.sandia.zcalc.language.Token;
import gov.sandia.zcalc.language.type.Complex;

/**
    Phase angle in (-pi, pi].
**/
public class Argument extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "arg";
            }

            public Token createInstance ()
            {
                return new Argument ();
            }
        };
    }

    public Complex eval (Complex a)
    {
        return new Complex (a.arg ());
    }

    public String toString ()
    {
        return "arg";
    }
}
