/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.zcalc.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
    Serialization of an MNode tree as indented key:value lines, preceded by a header line
    of the form "ZCalc.schema=1". Each level of nesting adds one space of indentation.
    <pre>
    ZCalc.schema=1
    Differentiate
     maxDepth:1000
    </pre>
**/
public class Schema
{
    public static final String HEADER = "ZCalc.schema";

    public int version;

    public Schema (int version)
    {
        this.version = version;
    }

    public static Schema latest ()
    {
        return new Schema (1);
    }

    /**
        Reads the header, then loads all the entries as children of the given node.
        Existing children of node that are not mentioned in the stream are left alone.
    **/
    public static Schema readAll (MNode node, Reader reader) throws IOException
    {
        LineReader lineReader = new LineReader (reader);
        Schema result = read (lineReader);
        lineReader.getNextLine ();
        result.read (node, lineReader, lineReader.whitespaces);
        return result;
    }

    public static Schema read (LineReader reader) throws IOException
    {
        String line = reader.line;
        if (line == null) throw new IOException ("File is empty.");
        line = line.trim ();
        if (! line.startsWith (HEADER + "=")) throw new IOException ("Schema line not found.");
        try
        {
            return new Schema (Integer.parseInt (line.substring (HEADER.length () + 1).trim ()));
        }
        catch (NumberFormatException e)
        {
            throw new IOException ("Malformed schema line.", e);
        }
    }

    /**
        Recursive loader for children. LineReader always holds the next unprocessed line.
    **/
    public void read (MNode node, LineReader reader, int whitespaces) throws IOException
    {
        while (true)
        {
            if (reader.line == null) return;  // stop at end of file

            String line  = reader.line.trim ();
            String key   = line;
            String value = null;
            int colon = line.indexOf (':');
            if (colon >= 0)
            {
                key   = line.substring (0, colon).trim ();
                value = line.substring (colon + 1).trim ();
            }

            reader.getNextLine ();
            MNode child = node.set (value, key);
            if (reader.whitespaces > whitespaces) read (child, reader, reader.whitespaces);
            if (reader.whitespaces < whitespaces) return;
        }
    }

    public void writeAll (MNode node, Writer writer) throws IOException
    {
        writer.write (String.format ("%s=%d%n", HEADER, version));
        for (MNode c : node) write (c, writer, "");
    }

    public void write (MNode node, Writer writer, String indent) throws IOException
    {
        String key = node.key ();
        if (node.data ()) writer.write (String.format ("%s%s:%s%n", indent, key, node.get ()));
        else              writer.write (String.format ("%s%s%n",    indent, key));

        String space1 = indent + " ";
        for (MNode c : node) write (c, writer, space1);
    }

    public static class LineReader
    {
        public BufferedReader reader;
        public String         line;
        public int            whitespaces;

        public LineReader (Reader reader) throws IOException
        {
            if (reader instanceof BufferedReader) this.reader = (BufferedReader) reader;
            else                                  this.reader = new BufferedReader (reader);
            getNextLine ();
        }

        /**
            Advances to the next line that is neither blank nor a comment (starting with #).
        **/
        public void getNextLine () throws IOException
        {
            while (true)
            {
                line = reader.readLine ();
                if (line == null)
                {
                    whitespaces = -1;
                    return;
                }
                String trimmed = line.trim ();
                if (trimmed.isEmpty ()  ||  trimmed.startsWith ("#")) continue;
                break;
            }

            int length = line.length ();
            whitespaces = 0;
            while (whitespaces < length  &&  line.charAt (whitespaces) == ' ') whitespaces++;
        }
    }
}
