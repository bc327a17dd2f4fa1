/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language;

import gov.sandia.zcalc.calculus.Differentiator;
import gov.sandia.zcalc.language.type.Complex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import org.apache.log4j.Logger;

/**
    A math expression as a flat sequence of tokens, in either infix or postfix order.
    The sequence is owned by this object. Copies duplicate the list, though the tokens
    themselves (being immutable) are shared.

    Subexpressions are addressed as half-open index ranges [begin,end) into one sequence,
    rather than as separate objects. See subexpressionStart(int).
**/
public class Expression implements Iterable<Token>
{
    private static Logger logger = Logger.getLogger (Expression.class);

    protected List<Token> tokens;
    public    boolean     postfix;

    /**
        Creates an empty postfix expression.
    **/
    public Expression ()
    {
        this (true);
    }

    public Expression (boolean postfix)
    {
        tokens       = new ArrayList<Token> ();
        this.postfix = postfix;
    }

    public Expression (List<Token> tokens, boolean postfix)
    {
        this.tokens  = new ArrayList<Token> (tokens);
        this.postfix = postfix;
    }

    public Expression (Expression that)
    {
        this (that.tokens, that.postfix);
    }

    /**
        Tokenizes the given infix text.
    **/
    public static Expression parse (String infix) throws ParseException
    {
        return Tokenizer.parse (infix);
    }

    public int size ()
    {
        return tokens.size ();
    }

    public Token get (int index)
    {
        return tokens.get (index);
    }

    public void add (Token t)
    {
        tokens.add (t);
    }

    public Expression append (Token... t)
    {
        for (Token a : t) tokens.add (a);
        return this;
    }

    public Expression append (Expression that)
    {
        tokens.addAll (that.tokens);
        return this;
    }

    /**
        Copies the range [begin,end) into a new expression with the same notation flag.
    **/
    public Expression slice (int begin, int end)
    {
        return new Expression (tokens.subList (begin, end), postfix);
    }

    /**
        Replaces the range [begin,end) with the contents of another expression.
    **/
    public void replace (int begin, int end, Expression that)
    {
        List<Token> range = tokens.subList (begin, end);
        range.clear ();
        range.addAll (that.tokens);
    }

    public Iterator<Token> iterator ()
    {
        return tokens.iterator ();
    }

    /**
        @return true if this is a single constant token.
    **/
    public boolean isConstant ()
    {
        return tokens.size () == 1  &&  tokens.get (0) instanceof Constant;
    }

    public boolean isVariable ()
    {
        return tokens.size () == 1  &&  tokens.get (0) instanceof Variable;
    }

    public boolean isZero ()
    {
        return isConstant ()  &&  ((Constant) tokens.get (0)).value.isZero ();
    }

    public boolean isOne ()
    {
        return isConstant ()  &&  ((Constant) tokens.get (0)).value.isOne ();
    }

    /**
        Checks the postfix arity invariant: scanning left to right, every function has at least
        one value available, every binary operator has at least two, and exactly one value remains
        at the end. Brackets count as values here, the same way subexpressionStart() treats them;
        evaluation and differentiation reject them separately.
    **/
    public boolean isWellFormed ()
    {
        int count = 0;
        for (Token t : tokens)
        {
            if (t instanceof OperatorBinary)
            {
                if (count < 2) return false;
                count--;
            }
            else if (t instanceof Function)
            {
                if (count < 1) return false;
            }
            else
            {
                count++;
            }
        }
        return count == 1;
    }

    /**
        Finds the smallest self-contained postfix subexpression that ends just before the given
        position. For example, in [5 3 4 * -] the subexpression ending before "-" is [3 4 *].
        Scanning backward, a single demand for one value is outstanding. A binary operator creates
        two new demands, a function one. Each token visited fills one demand. The scan stops as soon
        as no demand remains.
        @param end Exclusive upper bound of the subexpression. Must be in 1..size().
        @return Index of the first token of the subexpression.
        @throws IllegalArgumentException if end is out of range or the scan runs off the front,
        which means the sequence before end is not well-formed.
    **/
    public int subexpressionStart (int end)
    {
        if (end < 1  ||  end > tokens.size ()) throw new IllegalArgumentException ("Subexpression end out of range: " + end);
        int start  = end;
        int demand = 1;
        while (demand > 0)
        {
            if (--start < 0) throw new IllegalArgumentException ("Incomplete subexpression ending at " + end + " in " + this);
            Token t = tokens.get (start);
            if      (t instanceof OperatorBinary) demand += 2;
            else if (t instanceof Function)       demand += 1;
            demand--;
        }
        return start;
    }

    /**
        Converts infix to postfix with the shunting-yard algorithm. A function waits on the operator
        stack until its bracketed argument closes, or until an operator of equal or lower precedence
        forces it out. Equal precedence also pops, so chains group left to right.
        @return A new postfix expression. If this is already postfix, a copy of it.
    **/
    public Expression toPostfix () throws SyntaxException
    {
        if (postfix) return new Expression (this);

        Expression   result = new Expression (true);
        Deque<Token> stack  = new ArrayDeque<Token> ();
        for (Token t : tokens)
        {
            if (t instanceof Variable  ||  t instanceof Constant)
            {
                result.add (t);
            }
            else if (t instanceof Function)
            {
                stack.push (t);
            }
            else if (t instanceof OperatorBinary)
            {
                int p = t.precedence ();
                while (! stack.isEmpty ()  &&  ! isOpen (stack.peek ())  &&  stack.peek ().precedence () >= p)
                {
                    result.add (stack.pop ());
                }
                stack.push (t);
            }
            else if (isOpen (t))
            {
                stack.push (t);
            }
            else  // close bracket
            {
                while (true)
                {
                    if (stack.isEmpty ()) throw new SyntaxException ("Mismatched brackets in infix expression.");
                    Token top = stack.pop ();
                    if (isOpen (top)) break;
                    result.add (top);
                }
                if (stack.peek () instanceof Function) result.add (stack.pop ());
            }
        }

        while (! stack.isEmpty ())
        {
            Token top = stack.pop ();
            if (isOpen (top)) throw new SyntaxException ("Mismatched brackets in infix expression.");
            result.add (top);
        }

        if (logger.isDebugEnabled ()) logger.debug ("postfix " + this + " -> " + result);
        return result;
    }

    protected static boolean isOpen (Token t)
    {
        return t instanceof Bracket  &&  ((Bracket) t).open;
    }

    public Complex evaluate (Complex z)
    {
        return Evaluator.evaluate (this, z);
    }

    public Expression differentiate () throws DifferentiationException
    {
        return Differentiator.differentiate (this);
    }

    /**
        Display form, for example [3 4 2 * +]. Not intended to be parsed back.
    **/
    public String toString ()
    {
        StringBuilder result = new StringBuilder ("[");
        boolean first = true;
        for (Token t : tokens)
        {
            if (! first) result.append (" ");
            result.append (t.toString ());
            first = false;
        }
        result.append ("]");
        return result.toString ();
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Expression)) return false;
        Expression e = (Expression) that;
        return postfix == e.postfix  &&  tokens.equals (e.tokens);
    }

    public int hashCode ()
    {
        return tokens.hashCode () * 2 + (postfix ? 1 : 0);
    }
}
