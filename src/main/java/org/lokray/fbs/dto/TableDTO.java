package org.lokray.fbs.dto;

import java.util.ArrayList;
import java.util.List;

public class TableDTO
{
	public String name;
	public int slots;
	public List<FieldDTO> fields = new ArrayList<>();
	public List<String> doc;
}
