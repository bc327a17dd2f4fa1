/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language.operator;

import gov.sandia.zcalc.language.OperatorBinary;
import gov.sandia.zcalc.language.Token;
import gov.sandia.zcalc.language.type.Complex;

/**
    Exponentiation. Like the other binary operators it groups left to right during conversion,
    so 2^3^2 means (2^3)^2.
**/
public class Power extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "^";
            }

            public Token createInstance ()
            {
                return new Power ();
            }
        };
    }

    public int precedence ()
    {
        return 2;
    }

    public Complex eval (Complex a, Complex b)
    {
        return a.power (b);
    }

    public String toString ()
    {
        return "^";
    }
}
