/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language.function;

import gov.sandia.zcalc.language.Expression;
import gov.sandia.zcalc.language.Function;
import gov.sandia.zcalc.language.Token;
import gov.sandia.zcalc.language.operator.Negate;
import gov.sandia.zcalc.language.type.Complex;

/**
    Inverse cosine, principal branch: pi/2 - asin(z).
**/
public class ArcCosine extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "acos";
            }

            public Token createInstance ()
            {
                return new ArcCosine ();
            }
        };
    }

    public Complex eval (Complex a)
    {
        return a.acos ();
    }

    public Expression derivative (Expression g)
    {
        Expression result = new ArcSine ().derivative (g);
        result.add (new Negate ());
        return result;
    }

    public String toString ()
    {
        return "acos";
    }
}
