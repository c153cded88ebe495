package org.lokray.fbs.dto;

import java.util.ArrayList;
import java.util.List;

public class EnumDTO
{
	public String name;
	public String underlyingType;
	public List<EnumValueDTO> values = new ArrayList<>();
	public List<String> doc;
}
