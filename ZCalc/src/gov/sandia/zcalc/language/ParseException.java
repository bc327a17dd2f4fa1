/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language;

import java.io.PrintStream;

/**
    Raised by the tokenizer. Carries the whitespace-free line that was being scanned
    and the column where the problem was found.
**/
@SuppressWarnings("serial")
public class ParseException extends LanguageException
{
    public String line = "";
    public int column = -1;

    public ParseException (String message)
    {
        super (message);
    }

    public ParseException (String message, String line, int column)
    {
        super (message);
        this.line   = line;
        this.column = column;
    }

    public void print (PrintStream ps)
    {
        ps.println (getMessage ());
        ps.println (line);
        for (int i = 0; i < column; i++) ps.print (" ");
        ps.println ("^");
    }
}
