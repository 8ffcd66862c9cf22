@NullMarked
package org.springaicommunity.clabot.app;

import org.jspecify.annotations.NullMarked;
