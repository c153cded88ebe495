package org.lokray.fbs.util;

import java.io.PrintStream;

public class Debug
{
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Debug output is off unless the CLI is run with -v.
	public static volatile boolean ENABLE_DEBUG = false;

	// Colors are dropped when output is redirected, e.g. in tests.
	public static volatile boolean ENABLE_COLOR = true;

	private static volatile PrintStream out = System.out;
	private static volatile PrintStream err = System.err;

	public static void redirect(PrintStream newOut, PrintStream newErr)
	{
		out = newOut;
		err = newErr;
	}

	public static void log(String log)
	{
		out.println(log);
	}

	public static void logInfo(String log)
	{
		out.println(colored(ANSI_GREEN, log));
	}

	public static void logDebug(String log)
	{
		if (ENABLE_DEBUG)
		{
			out.println(log);
		}
	}

	public static void logWarning(String log)
	{
		out.println(colored(ANSI_YELLOW, log));
	}

	public static void logError(String log)
	{
		err.println(colored(ANSI_RED, log));
	}

	private static String colored(String color, String log)
	{
		return ENABLE_COLOR ? color + log + ANSI_RESET : log;
	}
}
