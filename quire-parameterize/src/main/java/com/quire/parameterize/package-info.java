/**
 * Parameter injection: rendering values into a notebook's parameters cell, redacting sensitive
 * values, inspecting declared names, and templating output paths.
 */
package com.quire.parameterize;
