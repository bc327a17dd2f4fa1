/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language.function;

import gov.sandia.zcalc.language.Constant;
import gov.sandia.zcalc.language.Expression;
import gov.sandia.zcalc.language.Function;
import gov.sandia.zcalc.language.Token;
import gov.sandia.zcalc.language.operator.Divide;
import gov.sandia.zcalc.language.operator.Negate;
import gov.sandia.zcalc.language.operator.Power;
import gov.sandia.zcalc.language.type.Complex;

public class Cotangent extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "cot";
            }

            public Token createInstance ()
            {
                return new Cotangent ();
            }
        };
    }

    public Complex eval (Complex a)
    {
        return a.tan ().reciprocal ();
    }

    public Expression derivative (Expression g)
    {
        // -1/sin^2(g)
        return new Expression ()
            .append (new Constant (1))
            .append (g)
            .append (new Sine (), new Constant (2), new Power (), new Divide (), new Negate ());
    }

    public String toString ()
    {
        return "cot";
    }
}
