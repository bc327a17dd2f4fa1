/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language.operator;

import gov.sandia.zcalc.language.Constant;
import gov.sandia.zcalc.language.Expression;
import gov.sandia.zcalc.language.Function;
import gov.sandia.zcalc.language.Token;
import gov.sandia.zcalc.language.type.Complex;

/**
    Unary minus. The tokenizer produces this for a minus sign at the start of input or right
    after an open bracket. It may also be written as \neg.
**/
public class Negate extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "neg";
            }

            public Token createInstance ()
            {
                return new Negate ();
            }
        };
    }

    public int precedence ()
    {
        return 1;
    }

    public Complex eval (Complex a)
    {
        return a.negate ();
    }

    public Expression derivative (Expression argument)
    {
        return new Expression ().append (new Constant (-1));
    }

    public String toString ()
    {
        return "neg";
    }
}
