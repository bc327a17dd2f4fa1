/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language;

import gov.sandia.zcalc.language.type.Complex;

import java.util.ArrayDeque;
import java.util.Deque;

/**
    Stack machine over a postfix expression.
**/
public class Evaluator
{
    public static Complex evaluate (Expression expression, Complex z)
    {
        if (! expression.postfix) throw new EvaluationException ("Can only evaluate a postfix expression.");

        Deque<Complex> stack = new ArrayDeque<Complex> ();
        for (Token t : expression)
        {
            if (t instanceof Variable)
            {
                stack.push (z);
            }
            else if (t instanceof Constant)
            {
                stack.push (((Constant) t).value);
            }
            else if (t instanceof Function)
            {
                if (stack.isEmpty ()) throw new EvaluationException ("Stack underflow at " + t);
                stack.push (((Function) t).eval (stack.pop ()));
            }
            else if (t instanceof OperatorBinary)
            {
                if (stack.size () < 2) throw new EvaluationException ("Stack underflow at " + t);
                Complex b = stack.pop ();
                Complex a = stack.pop ();
                stack.push (((OperatorBinary) t).eval (a, b));
            }
            else
            {
                throw new EvaluationException ("Unexpected token in postfix expression: " + t);
            }
        }

        if (stack.size () != 1) throw new EvaluationException ("Expression left " + stack.size () + " values on the stack.");
        return stack.pop ();
    }
}
