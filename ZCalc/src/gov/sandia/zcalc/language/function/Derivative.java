/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language.function;

import gov.sandia.zcalc.language.EvaluationException;
import gov.sandia.zcalc.language.Function;
import gov.sandia.zcalc.language.Token;
import gov.sandia.zcalc.language.type.Complex;

/**
    Marks its argument for symbolic differentiation, as in \deriv(z^2).
    Differentiator.resolveDerivatives() replaces each marked subexpression with its derivative.
    A marker that survives to evaluation is an error. eval() raises EvaluationException
    and never yields 0.
**/
public class Derivative extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "deriv";
            }

            public Token createInstance ()
            {
                return new Derivative ();
            }
        };
    }

    public Complex eval (Complex a)
    {
        throw new EvaluationException ("Unresolved derivative marker. Resolve derivatives before evaluating.");
    }

    public String toString ()
    {
        return "deriv";
    }
}
