/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language.type;

import gov.sandia.zcalc.db.AppData;

/**
    Immutable complex number. All multi-valued functions return the principal branch.
**/
public final class Complex
{
    public final double real;
    public final double imag;

    public static final Complex ZERO = new Complex (0);
    public static final Complex ONE  = new Complex (1);
    public static final Complex I    = new Complex (0, 1);
    public static final Complex E    = new Complex (Math.E);
    public static final Complex PI   = new Complex (Math.PI);

    /**
        Largest integer exponent magnitude that power(Complex) computes by repeated squaring.
        Read once from the Evaluate.integerPower setting when this class loads.
    **/
    public static final int INTEGER_POWER = AppData.properties.getOrDefault (64, "Evaluate", "integerPower");

    public Complex (double real)
    {
        this (real, 0);
    }

    public Complex (double real, double imag)
    {
        this.real = real;
        this.imag = imag;
    }

    public boolean isZero ()
    {
        return real == 0  &&  imag == 0;
    }

    public boolean isOne ()
    {
        return real == 1  &&  imag == 0;
    }

    public boolean isReal ()
    {
        return imag == 0;
    }

    public boolean isNaN ()
    {
        return Double.isNaN (real)  ||  Double.isNaN (imag);
    }

    public Complex add (Complex that)
    {
        return new Complex (real + that.real, imag + that.imag);
    }

    public Complex add (double that)
    {
        return new Complex (real + that, imag);
    }

    public Complex subtract (Complex that)
    {
        return new Complex (real - that.real, imag - that.imag);
    }

    public Complex multiply (Complex that)
    {
        return new Complex (real * that.real - imag * that.imag, real * that.imag + imag * that.real);
    }

    public Complex multiply (double that)
    {
        return new Complex (real * that, imag * that);
    }

    /**
        Smith's algorithm, which avoids overflow in the intermediate |that|^2.
    **/
    public Complex divide (Complex that)
    {
        double c = that.real;
        double d = that.imag;
        if (Math.abs (c) >= Math.abs (d))
        {
            if (c == 0  &&  d == 0) return new Complex (real / 0.0, imag / 0.0);
            double r   = d / c;
            double den = c + d * r;
            return new Complex ((real + imag * r) / den, (imag - real * r) / den);
        }
        double r   = c / d;
        double den = c * r + d;
        return new Complex ((real * r + imag) / den, (imag * r - real) / den);
    }

    public Complex reciprocal ()
    {
        return ONE.divide (this);
    }

    public Complex negate ()
    {
        return new Complex (-real, -imag);
    }

    public Complex conjugate ()
    {
        return new Complex (real, -imag);
    }

    public double abs ()
    {
        return Math.hypot (real, imag);
    }

    public double arg ()
    {
        return Math.atan2 (imag, real);
    }

    public Complex exp ()
    {
        double m = Math.exp (real);
        return new Complex (m * Math.cos (imag), m * Math.sin (imag));
    }

    public Complex log ()
    {
        return new Complex (Math.log (abs ()), arg ());
    }

    public Complex sqrt ()
    {
        if (isZero ()) return ZERO;
        double t = Math.sqrt ((Math.abs (real) + abs ()) / 2);
        if (real >= 0) return new Complex (t, imag / (2 * t));
        return new Complex (Math.abs (imag) / (2 * t), Math.copySign (t, imag));
    }

    /**
        Raises this number to the given power. A real integer exponent no larger in magnitude
        than INTEGER_POWER is computed exactly by repeated squaring.
    **/
    public Complex power (Complex that)
    {
        return power (that, INTEGER_POWER);
    }

    /**
        @param limit Largest integer exponent magnitude to compute by repeated squaring.
        Larger exponents, and all others, go through exp(that * log(this)).
    **/
    public Complex power (Complex that, int limit)
    {
        if (that.isZero ()) return ONE;
        if (isZero ()  &&  that.real > 0) return ZERO;

        if (that.imag == 0  &&  that.real == Math.rint (that.real))
        {
            if (Math.abs (that.real) <= limit)
            {
                long n = (long) Math.abs (that.real);
                Complex result = ONE;
                Complex base   = this;
                while (n > 0)
                {
                    if ((n & 1) != 0) result = result.multiply (base);
                    base = base.multiply (base);
                    n >>= 1;
                }
                if (that.real < 0) return result.reciprocal ();
                return result;
            }
        }
        return that.multiply (log ()).exp ();
    }

    public Complex sin ()
    {
        return new Complex (Math.sin (real) * Math.cosh (imag), Math.cos (real) * Math.sinh (imag));
    }

    public Complex cos ()
    {
        return new Complex (Math.cos (real) * Math.cosh (imag), -Math.sin (real) * Math.sinh (imag));
    }

    public Complex tan ()
    {
        double a   = 2 * real;
        double b   = 2 * imag;
        double den = Math.cos (a) + Math.cosh (b);
        return new Complex (Math.sin (a) / den, Math.sinh (b) / den);
    }

    public Complex sinh ()
    {
        return new Complex (Math.sinh (real) * Math.cos (imag), Math.cosh (real) * Math.sin (imag));
    }

    public Complex cosh ()
    {
        return new Complex (Math.cosh (real) * Math.cos (imag), Math.sinh (real) * Math.sin (imag));
    }

    public Complex tanh ()
    {
        double a   = 2 * real;
        double b   = 2 * imag;
        double den = Math.cosh (a) + Math.cos (b);
        return new Complex (Math.sinh (a) / den, Math.sin (b) / den);
    }

    // asin(z) = -i log(iz + sqrt(1-z^2))
    public Complex asin ()
    {
        Complex root = ONE.subtract (multiply (this)).sqrt ();
        return I.multiply (this).add (root).log ().multiply (I).negate ();
    }

    public Complex acos ()
    {
        return new Complex (Math.PI / 2).subtract (asin ());
    }

    // atan(z) = i/2 (log(1-iz) - log(1+iz))
    public Complex atan ()
    {
        Complex iz = I.multiply (this);
        Complex d  = ONE.subtract (iz).log ().subtract (ONE.add (iz).log ());
        return I.multiply (d).multiply (0.5);
    }

    public Complex asinh ()
    {
        return add (multiply (this).add (1).sqrt ()).log ();
    }

    public Complex acosh ()
    {
        return add (add (1).sqrt ().multiply (add (-1).sqrt ())).log ();
    }

    public Complex atanh ()
    {
        return ONE.add (this).log ().subtract (ONE.subtract (this).log ()).multiply (0.5);
    }

    public static String format (double value)
    {
        if (value == 0) return "0";  // Also catches negative zero.
        if (value == Math.rint (value)  &&  Math.abs (value) < 1e15) return String.valueOf ((long) value);
        return String.valueOf (value);
    }

    /**
        Purely real values print as a plain number. Others use the same bracket form the tokenizer accepts.
    **/
    public String toString ()
    {
        if (imag == 0) return format (real);
        return "[" + format (real) + "," + format (imag) + "]";
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Complex)) return false;
        Complex c = (Complex) that;
        return real == c.real  &&  imag == c.imag;
    }

    public int hashCode ()
    {
        // Adding 0.0 folds negative zero into positive zero, consistent with equals().
        return Double.hashCode (real + 0.0) * 31 + Double.hashCode (imag + 0.0);
    }
}
