package org.lokray.fbs.dto;

public class EnumValueDTO
{
	public String name;
	// Schema spelling, so ulong values above Long.MAX_VALUE survive
	public String value;
}
