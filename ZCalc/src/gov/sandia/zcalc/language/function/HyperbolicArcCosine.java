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
import gov.sandia.zcalc.language.operator.Add;
import gov.sandia.zcalc.language.operator.Divide;
import gov.sandia.zcalc.language.operator.Multiply;
import gov.sandia.zcalc.language.operator.Power;
import gov.sandia.zcalc.language.operator.Subtract;
import gov.sandia.zcalc.language.type.Complex;

/**
    Inverse hyperbolic cosine, principal branch: log(z + sqrt(z+1) sqrt(z-1)).
**/
public class HyperbolicArcCosine extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "acosh";
            }

            public Token createInstance ()
            {
                return new HyperbolicArcCosine ();
            }
        };
    }

    public Complex eval (Complex a)
    {
        return a.acosh ();
    }

    public Expression derivative (Expression g)
    {
        // 1/(sqrt(g-1) sqrt(g+1)), which follows the same branch cut as acosh itself.
        return new Expression ()
            .append (new Constant (1))
            .append (g)
            .append (new Constant (1), new Subtract (), new Constant (0.5), new Power ())
            .append (g)
            .append (new Constant (1), new Add (), new Constant (0.5), new Power ())
            .append (new Multiply (), new Divide ());
    }

    public String toString ()
    {
        return "acosh";
    }
}
