/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.language;

/**
    Raised during infix-to-postfix conversion when brackets do not pair up.
**/
@SuppressWarnings("serial")
public class SyntaxException extends LanguageException
{
    public SyntaxException (String message)
    {
        super (message);
    }
}
