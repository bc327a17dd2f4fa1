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
import gov.sandia.zcalc.language.type.Complex;

/**
    Natural logarithm, principal branch. The imaginary part of the result lies in (-pi, pi].
**/
public class Log extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "log";
            }

            public Token createInstance ()
            {
                return new Log ();
            }
        };
    }

    public Complex eval (Complex a)
    {
        return a.log ();
    }

    public Expression derivative (Expression g)
    {
        return new Expression ().append (new Constant (1)).append (g).append (new Divide ());
    }

    public String toString ()
    {
        return "log";
    }
}
