/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language;

import gov.sandia.zcalc.language.type.Complex;

/**
    A function of one argument. In infix it is written as a prefix, usually followed by a bracketed
    argument. In postfix it follows its argument.
**/
public abstract class Function extends Token
{
    public int precedence ()
    {
        return 3;
    }

    public abstract Complex eval (Complex a);

    /**
        Builds the derivative of this function with respect to its argument, evaluated at the
        given argument. For example, sin returns [g cos]. The caller applies the chain rule.
        @param argument Postfix subexpression g. Implementations copy it into the result as many
        times as needed, and must not modify it.
        @return Postfix expression for f'(g).
        @throws DifferentiationException if this function has no derivative rule.
    **/
    public Expression derivative (Expression argument) throws DifferentiationException
    {
        throw new DifferentiationException ("Derivative not found: " + this);
    }
}
