// file: src/main/java/io/tabver/server/dto/TableJson.java
package io.tabver.server.dto;

import java.util.List;

/**
 * JSON form of a normalized table.
 * Example:
 *   {
 *     "sheets": [
 *       { "name": "Sheet1", "cells": [ { "row": 0, "column": 0, "type": "number", "value": 10 } ] }
 *     ]
 *   }
 */
public class TableJson {
    public List<SheetJson> sheets;
}
