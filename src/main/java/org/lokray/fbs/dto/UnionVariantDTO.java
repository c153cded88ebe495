package org.lokray.fbs.dto;

public class UnionVariantDTO
{
	public String name;
	public int value;
	public String table;
}
