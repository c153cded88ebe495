package org.lokray.fbs.dto;

import java.util.ArrayList;
import java.util.List;

public class UnionDTO
{
	public String name;
	public List<UnionVariantDTO> variants = new ArrayList<>();
	public List<String> doc;
}
