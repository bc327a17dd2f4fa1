/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.calculus;

import gov.sandia.zcalc.db.AppData;
import gov.sandia.zcalc.language.Constant;
import gov.sandia.zcalc.language.DifferentiationException;
import gov.sandia.zcalc.language.Expression;
import gov.sandia.zcalc.language.Function;
import gov.sandia.zcalc.language.OperatorBinary;
import gov.sandia.zcalc.language.Token;
import gov.sandia.zcalc.language.Variable;
import gov.sandia.zcalc.language.function.Derivative;
import gov.sandia.zcalc.language.function.Log;
import gov.sandia.zcalc.language.operator.Add;
import gov.sandia.zcalc.language.operator.Divide;
import gov.sandia.zcalc.language.operator.Multiply;
import gov.sandia.zcalc.language.operator.Negate;
import gov.sandia.zcalc.language.operator.Power;
import gov.sandia.zcalc.language.operator.Subtract;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
    Symbolic differentiation with respect to z. Works directly on index ranges [begin,end) of
    a single postfix sequence, using Expression.subexpressionStart() to split each range into
    operands. Results are fresh postfix expressions. Terms that are exactly 0 are dropped and
    factors that are exactly 1 are elided, so the output stays close to what one would write by hand.
**/
public class Differentiator
{
    private static Logger logger = Logger.getLogger (Differentiator.class);

    protected Expression source;
    protected int        maxDepth;

    protected Differentiator (Expression source)
    {
        this.source = source;
        maxDepth    = AppData.properties.getOrDefault (1000, "Differentiate", "maxDepth");
    }

    /**
        @param postfix A well-formed postfix expression. It is not modified.
        @return A new postfix expression for the derivative.
    **/
    public static Expression differentiate (Expression postfix) throws DifferentiationException
    {
        check (postfix);
        Differentiator d = new Differentiator (postfix);
        Expression result = d.differentiate (0, postfix.size (), 0);
        if (logger.isDebugEnabled ()) logger.debug ("d/dz " + postfix + " = " + result);
        return result;
    }

    /**
        Replaces every [g deriv] subexpression with the derivative of g. Markers are processed left
        to right, which in postfix order means inner markers before the ones enclosing them. Thus
        nested markers produce higher derivatives.
        @return A new postfix expression free of derivative markers.
    **/
    public static Expression resolveDerivatives (Expression postfix) throws DifferentiationException
    {
        check (postfix);
        Expression result = new Expression (postfix);
        for (int i = 0; i < result.size (); i++)
        {
            if (! (result.get (i) instanceof Derivative)) continue;
            int start = result.subexpressionStart (i);
            Differentiator d = new Differentiator (result);
            Expression derivative = d.differentiate (start, i, 0);
            result.replace (start, i + 1, derivative);
            i = start + derivative.size () - 1;
        }
        if (logger.isDebugEnabled ()) logger.debug ("resolved " + postfix + " -> " + result);
        return result;
    }

    protected static void check (Expression e) throws DifferentiationException
    {
        if (! e.postfix)        throw new DifferentiationException ("Can only differentiate a postfix expression.");
        if (! e.isWellFormed ()) throw new DifferentiationException ("Expression is not well-formed: " + e);
    }

    protected Expression differentiate (int begin, int end, int depth) throws DifferentiationException
    {
        if (depth > maxDepth) throw new DifferentiationException ("Expression nested too deeply to differentiate (limit " + maxDepth + ")");

        Token t = source.get (end - 1);
        if (t instanceof Variable) return constant (1);
        if (t instanceof Constant) return constant (0);

        if (t instanceof Function)
        {
            Function f = (Function) t;
            Expression g = source.slice (begin, end - 1);
            if (g.isConstant ()) return constant (0);
            if (g.isVariable ()) return f.derivative (g);
            Expression fPrime = f.derivative (g);
            Expression gPrime = differentiate (begin, end - 1, depth + 1);
            return multiply (gPrime, fPrime);
        }

        if (t instanceof OperatorBinary)
        {
            if (isSum (t))             return sum     (begin, end, depth);
            if (t instanceof Multiply) return product (begin, end, depth);
            int mid = source.subexpressionStart (end - 1);
            if (t instanceof Divide)   return quotient (begin, mid, end - 1, depth);
            if (t instanceof Power)    return power    (begin, mid, end - 1, depth);
        }

        throw new DifferentiationException ("Unrecognized token to differentiate: " + t);
    }

    protected static boolean isSum (Token t)
    {
        return t instanceof Add  ||  t instanceof Subtract;
    }

    /**
        Collects the operators along the left spine of a chain such as [a b + c - d +], where
        each left operand ends with another operator of the same kind. The chain is walked with
        a loop, so its length does not count against the depth limit. Only the right operands,
        and the leftmost operand at the bottom of the chain, are differentiated one level deeper.
        @return Positions of the chained operators, outermost first. The matching entry in mids
        receives the start of each operator's right operand.
    **/
    protected List<Integer> chain (int begin, int end, boolean sum, List<Integer> mids)
    {
        List<Integer> operators = new ArrayList<Integer> ();
        int p = end - 1;
        while (true)
        {
            int mid = source.subexpressionStart (p);
            operators.add (p);
            mids.add (mid);
            if (mid - 1 < begin) break;
            Token left = source.get (mid - 1);
            if (sum ? ! isSum (left) : ! (left instanceof Multiply)) break;
            p = mid - 1;
        }
        return operators;
    }

    /**
        Sum rule over a chain of additions and subtractions.
    **/
    protected Expression sum (int begin, int end, int depth) throws DifferentiationException
    {
        List<Integer> mids      = new ArrayList<Integer> ();
        List<Integer> operators = chain (begin, end, true, mids);

        int last = operators.size () - 1;
        Expression result = operand (begin, mids.get (last), depth);
        for (int i = last; i >= 0; i--)
        {
            int        p  = operators.get (i);
            Expression gp = operand (mids.get (i), p, depth);
            if (source.get (p) instanceof Add) result = add (result, gp);
            else if (gp.isZero ())             continue;
            else if (result.isZero ())         result = negate (gp);
            else                               result = new Expression ().append (result).append (gp).append (new Subtract ());
        }
        return result;
    }

    /**
        Product rule over a chain of multiplications. At each level, f is everything to the left
        of the operator and f' is the result accumulated so far.
    **/
    protected Expression product (int begin, int end, int depth) throws DifferentiationException
    {
        List<Integer> mids      = new ArrayList<Integer> ();
        List<Integer> operators = chain (begin, end, false, mids);

        int last = operators.size () - 1;
        Expression result = operand (begin, mids.get (last), depth);
        for (int i = last; i >= 0; i--)
        {
            int        p   = operators.get (i);
            int        mid = mids.get (i);
            Expression f   = source.slice (begin, mid);
            Expression g   = source.slice (mid,   p);
            result = add (multiply (result, g), partialProduct (g, mid, p, f, depth));
        }
        return result;
    }

    /**
        Derivative of an operand in [begin,end). A lone constant or variable is answered
        directly. Anything else is differentiated one level deeper.
    **/
    protected Expression operand (int begin, int end, int depth) throws DifferentiationException
    {
        if (end - begin == 1)
        {
            Token t = source.get (begin);
            if (t instanceof Constant) return constant (0);
            if (t instanceof Variable) return constant (1);
        }
        return differentiate (begin, end, depth + 1);
    }

    protected Expression quotient (int begin, int mid, int end, int depth) throws DifferentiationException
    {
        Expression f = source.slice (begin, mid);
        Expression g = source.slice (mid,   end);
        if (g.isConstant ())
        {
            Expression fp = differentiate (begin, mid, depth + 1);
            return multiply (fp, new Expression ().append (new Constant (1)).append (g).append (new Divide ()));
        }

        Expression p1 = partialProduct (f, begin, mid, g, depth);
        Expression p2 = partialProduct (g, mid,   end, f, depth);
        Expression numerator;
        if      (p1.isZero ()) numerator = negate (p2);
        else if (p2.isZero ()) numerator = p1;
        else                   numerator = new Expression ().append (p1).append (p2).append (new Subtract ());
        if (numerator.isZero ()) return numerator;

        return new Expression ()
            .append (numerator)
            .append (g).append (g).append (new Multiply ())
            .append (new Divide ());
    }

    /**
        Generalized power rule: d(f^g) = g f^(g-1) f' + f^g log(f) g'
    **/
    protected Expression power (int begin, int mid, int end, int depth) throws DifferentiationException
    {
        Expression f = source.slice (begin, mid);
        Expression g = source.slice (mid,   end);
        if (f.isZero ()) return constant (0);

        Expression term1;
        if (f.isConstant ())
        {
            term1 = constant (0);
        }
        else
        {
            Expression coefficient;
            if (g.isConstant ())
            {
                Constant n1 = new Constant (((Constant) g.get (0)).value.add (-1));
                Expression fn;
                if      (n1.value.isZero ()) fn = constant (1);
                else if (n1.value.isOne ())  fn = f;
                else                         fn = new Expression ().append (f).append (n1, new Power ());
                coefficient = multiply (g, fn);
            }
            else
            {
                coefficient = new Expression ()
                    .append (g)
                    .append (f).append (g).append (new Constant (1), new Subtract (), new Power ())
                    .append (new Multiply ());
            }
            if (f.isVariable ()) term1 = coefficient;
            else                 term1 = multiply (coefficient, differentiate (begin, mid, depth + 1));
        }

        Expression term2;
        if (g.isConstant ())
        {
            term2 = constant (0);
        }
        else
        {
            Expression base = new Expression ()
                .append (f).append (g).append (new Power ())
                .append (f).append (new Log ())
                .append (new Multiply ());
            if (g.isVariable ()) term2 = base;
            else                 term2 = multiply (base, differentiate (mid, end, depth + 1));
        }

        return add (term1, term2);
    }

    /**
        One term of the product rule: derivative of the operand in [begin,end), times the other operand.
    **/
    protected Expression partialProduct (Expression operand, int begin, int end, Expression other, int depth) throws DifferentiationException
    {
        if (operand.isConstant ()) return constant (0);
        if (operand.isVariable ()) return other;
        return multiply (differentiate (begin, end, depth + 1), other);
    }

    public static Expression constant (double value)
    {
        return new Expression ().append (new Constant (value));
    }

    public static Expression multiply (Expression a, Expression b)
    {
        if (a.isZero ()  ||  b.isZero ()) return constant (0);
        if (a.isOne ()) return new Expression (b);
        if (b.isOne ()) return new Expression (a);
        return new Expression ().append (a).append (b).append (new Multiply ());
    }

    public static Expression add (Expression a, Expression b)
    {
        if (a.isZero ()) return new Expression (b);
        if (b.isZero ()) return new Expression (a);
        return new Expression ().append (a).append (b).append (new Add ());
    }

    public static Expression negate (Expression e)
    {
        if (e.isZero ()) return constant (0);
        if (e.isConstant ()) return new Expression ().append (new Constant (((Constant) e.get (0)).value.negate ()));
        return new Expression ().append (e).append (new Negate ());
    }
}
