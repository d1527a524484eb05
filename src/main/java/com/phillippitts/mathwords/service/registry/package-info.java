/**
 * Read-only vocabulary shared by the parsers and the verbalizer: binary and unary operators,
 * big operators, fonts, fences, environments and the LaTeX command table.
 */
package com.phillippitts.mathwords.service.registry;
