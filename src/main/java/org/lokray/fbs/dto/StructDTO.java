package org.lokray.fbs.dto;

import java.util.ArrayList;
import java.util.List;

public class StructDTO
{
	public String name;
	public int size;
	public int alignment;
	public List<FieldDTO> fields = new ArrayList<>();
	public List<String> doc;
}
