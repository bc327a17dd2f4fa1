/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language;

import gov.sandia.zcalc.language.type.Complex;

public abstract class OperatorBinary extends Token
{
    /**
        @param a Left operand, which is the second-most-recent value on the evaluation stack.
        @param b Right operand, the most recent value.
    **/
    public abstract Complex eval (Complex a, Complex b);
}
