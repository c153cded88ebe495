package org.lokray.fbs.dto;

import java.util.Map;

/**
 * A table or struct field. Struct fields fill {@code offset}, {@code size}
 * and {@code padding}; table fields fill the rest.
 */
public class FieldDTO
{
	public String name;
	public String type;

	public Integer offset;
	public Integer size;
	public Integer padding;

	public Integer slot;
	public Integer vtableOffset;
	public String defaultValue;
	public Boolean required;
	public Boolean deprecated;
	public Boolean key;
	public Map<String, String> attributes;
}
