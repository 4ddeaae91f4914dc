/**
 * REST controllers for the local API.
 *
 * <ul>
 *   <li>{@code POST /api/parse} - front/back extraction with provider fallback</li>
 *   <li>{@code POST /api/parse/fields} - extraction of caller-defined fields</li>
 *   <li>{@code POST /api/providers/{id}/test} - connection test with a candidate key</li>
 *   <li>{@code GET /api/providers} - providers with persisted health, without keys</li>
 * </ul>
 */
package com.phillippitts.wordassist.presentation.controller;
