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

public class Cosine extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "cos";
            }

            public Token createInstance ()
            {
                return new Cosine ();
            }
        };
    }

    public Complex eval (Complex a)
    {
        return a.cos ();
    }

    public Expression derivative (Expression g)
    {
        return new Expression ().append (g).append (new Sine (), new Negate ());
    }

    public String toString ()
    {
        return "cos";
    }
}
