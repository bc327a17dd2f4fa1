/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language;

import gov.sandia.zcalc.language.operator.Negate;
import gov.sandia.zcalc.language.type.Complex;

import org.apache.log4j.Logger;

/**
    Scans infix text into an infix Expression. Whitespace is insignificant and is removed
    before scanning, so column numbers in errors refer to the compacted line.

    Named functions must be escaped with a backslash, as in \sin(z). The name runs up to the
    next operator, bracket or backslash. Single-character operators and brackets are written
    bare. Literals take the forms 12, 1.5, 2i, [re,im], i, e and pi. The variable is z.
**/
public class Tokenizer
{
    private static Logger logger = Logger.getLogger (Tokenizer.class);

    public static final char   ESCAPE      = '\\';
    public static final String TERMINATORS = "\\+-*/^(){}[";

    protected String line;
    protected int    position;

    protected Tokenizer (String text)
    {
        StringBuilder compact = new StringBuilder (text.length ());
        for (int i = 0; i < text.length (); i++)
        {
            char c = text.charAt (i);
            if (! Character.isWhitespace (c)) compact.append (c);
        }
        line = compact.toString ();
    }

    public static Expression parse (String text) throws ParseException
    {
        Tokenizer t = new Tokenizer (text);
        Expression result = t.scan ();
        if (logger.isDebugEnabled ()) logger.debug ("tokenized \"" + text + "\" -> " + result);
        return result;
    }

    protected Expression scan () throws ParseException
    {
        Expression result = new Expression (false);
        position = 0;
        while (position < line.length ()) result.add (next ());
        return result;
    }

    protected Token next () throws ParseException
    {
        char c = line.charAt (position);

        if (c == ESCAPE) return keyword ();

        if (c == '-'  &&  unaryPosition ())
        {
            position++;
            return new Negate ();
        }

        if (isDigit (c)  ||  c == '.') return number ();
        if (c == '[') return bracketedConstant ();

        if (c == 'i')
        {
            position++;
            return new Constant (Complex.I);
        }
        if (c == 'e')
        {
            position++;
            return new Constant (Complex.E);
        }
        if (line.startsWith ("pi", position))
        {
            position += 2;
            return new Constant (Complex.PI);
        }
        if (line.startsWith (Variable.NAME, position))
        {
            position += Variable.NAME.length ();
            return new Variable ();
        }

        Token result = Token.create (String.valueOf (c));
        if (result == null) throw new ParseException ("Unknown operation", line, position);
        position++;
        return result;
    }

    /**
        A minus sign is unary at the start of the line or right after an open bracket.
    **/
    protected boolean unaryPosition ()
    {
        if (position == 0) return true;
        char previous = line.charAt (position - 1);
        return previous == '('  ||  previous == '{';
    }

    protected Token keyword () throws ParseException
    {
        int begin = position + 1;
        int end   = begin;
        while (end < line.length ()  &&  TERMINATORS.indexOf (line.charAt (end)) < 0) end++;
        if (end >= line.length ()) throw new ParseException ("Operation end index not found", line, position);

        String name = line.substring (begin, end);
        Token result = Token.create (name);
        if (! (result instanceof Function)) throw new ParseException ("Unknown operation: " + name, line, begin);
        position = end;
        return result;
    }

    protected Token number () throws ParseException
    {
        int     begin = position;
        boolean dot   = false;
        while (position < line.length ())
        {
            char c = line.charAt (position);
            if (c == '.')
            {
                if (dot) throw new ParseException ("Number contains more than one decimal point", line, position);
                dot = true;
            }
            else if (! isDigit (c))
            {
                break;
            }
            position++;
        }

        String digits = line.substring (begin, position);
        if (digits.equals (".")) throw new ParseException ("Decimal point without digits", line, begin);
        double value = Double.parseDouble (digits);

        if (position < line.length ()  &&  line.charAt (position) == 'i')
        {
            position++;
            return new Constant (new Complex (0, value));
        }
        return new Constant (value);
    }

    /**
        General constant of the form [re,im]. Each part follows the same rules as a bare
        number, except that it may begin with a minus sign.
    **/
    protected Token bracketedConstant () throws ParseException
    {
        int comma = line.indexOf (',', position);
        if (comma < 0) throw new ParseException ("Missing comma in complex constant", line, position);
        int close = line.indexOf (']', comma);
        if (close < 0) throw new ParseException ("Missing close bracket in complex constant", line, position);

        double re = part (position + 1, comma);
        double im = part (comma + 1,    close);
        Constant result = new Constant (new Complex (re, im));
        position = close + 1;
        return result;
    }

    /**
        Parses one part of a bracketed constant, occupying [begin,end) of the line.
        Errors are reported at the open bracket, which is still the current position.
    **/
    protected double part (int begin, int end) throws ParseException
    {
        int     i      = begin;
        boolean dot    = false;
        boolean digits = false;
        if (i < end  &&  line.charAt (i) == '-') i++;
        for (; i < end; i++)
        {
            char c = line.charAt (i);
            if      (isDigit (c))        digits = true;
            else if (c == '.'  &&  ! dot) dot    = true;
            else throw new ParseException ("Malformed complex constant", line, position);
        }
        if (! digits) throw new ParseException ("Malformed complex constant", line, position);
        return Double.parseDouble (line.substring (begin, end));
    }

    protected static boolean isDigit (char c)
    {
        return c >= '0'  &&  c <= '9';
    }
}
