/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language.operator;

import gov.sandia.zcalc.language.OperatorBinary;
import gov.sandia.zcalc.language.Token;
import gov.sandia.zcalc.language.type.Complex;

public class Subtract extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "-";
            }

            public Token createInstance ()
            {
                return new Subtract ();
            }
        };
    }

    public int precedence ()
    {
        return 0;
    }

    public Complex eval (Complex a, Complex b)
    {
        return a.subtract (b);
    }

    public String toString ()
    {
        return "-";
    }
}
