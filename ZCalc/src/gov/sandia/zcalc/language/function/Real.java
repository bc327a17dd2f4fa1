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
    Real part. Not complex-differentiable, so it has no derivative rule.
**/
public class Real extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "re";
            }

            public Token createInstance ()
            {
                return new Real ();
            }
        };
    }

    public Complex eval (Complex a)
    {
        return new Complex (a.real);
    }

    public String toString ()
    {
        return "re";
    }
}
